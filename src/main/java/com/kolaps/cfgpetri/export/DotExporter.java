package com.kolaps.cfgpetri.export;

import com.kolaps.cfgpetri.net.Arc;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Graphviz: места кругами, переходы прямоугольниками.
 */
public class DotExporter implements PetriNetExporter {

    @Override
    public void export(PetriNet net, OutputStream out) throws IOException {
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        writer.write(toDot(net));
        writer.flush();
    }

    public String toDot(PetriNet net) {
        StringBuilder sb = new StringBuilder("digraph petrinet {\n");
        for (Place place : net.getPlaces()) {
            sb.append("    ").append(place.getLabel())
                    .append(" [shape=\"circle\" xlabel=\"").append(place.getLabel())
                    .append("\" label=\"").append(tokens(place)).append("\"];\n");
        }
        for (Transition transition : net.getTransitions()) {
            sb.append("    ").append(transition.getLabel())
                    .append(" [shape=\"box\" xlabel=\"").append(transition.getLabel())
                    .append("\" label=\"\"];\n");
        }
        for (Arc arc : net.getArcs()) {
            sb.append("    ").append(arc.getSource().getLabel()).append(" -> ").append(arc.getTarget().getLabel());
            if (arc.getWeight() != 1) {
                sb.append(" [label=\"").append(arc.getWeight()).append("\"]");
            }
            sb.append(";\n");
        }
        return sb.append("}\n").toString();
    }

    private static String tokens(Place place) {
        if (!place.isMarked()) {
            return "";
        }
        return place.getTokens() == 1 ? "•" : String.valueOf(place.getTokens());
    }
}
