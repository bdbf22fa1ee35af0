package com.kolaps.cfgpetri.export;

import com.google.common.base.Joiner;
import com.kolaps.cfgpetri.net.Arc;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Текстовый формат LoLA: список мест, начальная разметка и переходы с CONSUME / PRODUCE.
 */
public class LolaExporter implements PetriNetExporter {

    private static final Joiner ENTRIES = Joiner.on(",\n    ");

    @Override
    public void export(PetriNet net, OutputStream out) throws IOException {
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        writer.write(toLola(net));
        writer.flush();
    }

    public String toLola(PetriNet net) {
        StringBuilder sb = new StringBuilder();

        List<String> places = new ArrayList<>();
        for (Place place : net.getPlaces()) {
            places.add(place.getLabel());
        }
        section(sb, "PLACE", places);
        sb.append('\n');

        List<String> marking = new ArrayList<>();
        for (Map.Entry<Place, Integer> entry : net.getInitialMarking().entrySet()) {
            marking.add(entry.getKey().getLabel() + " : " + entry.getValue());
        }
        section(sb, "MARKING", marking);

        for (Transition transition : net.getTransitions()) {
            sb.append('\n').append("TRANSITION ").append(transition.getLabel()).append('\n');
            sb.append("  ");
            section(sb, "CONSUME", weighted(net.getInputArcs(transition), true));
            sb.append("  ");
            section(sb, "PRODUCE", weighted(net.getOutputArcs(transition), false));
        }
        return sb.toString();
    }

    private static List<String> weighted(List<Arc> arcs, boolean useSource) {
        List<String> result = new ArrayList<>();
        for (Arc arc : arcs) {
            String place = useSource ? arc.getSource().getLabel() : arc.getTarget().getLabel();
            result.add(place + " : " + arc.getWeight());
        }
        return result;
    }

    private static void section(StringBuilder sb, String keyword, List<String> entries) {
        if (entries.isEmpty()) {
            sb.append(keyword).append(";\n");
            return;
        }
        sb.append(keyword).append("\n    ");
        ENTRIES.appendTo(sb, entries);
        sb.append(";\n");
    }
}
