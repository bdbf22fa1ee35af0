package com.kolaps.cfgpetri.export;

import com.kolaps.cfgpetri.net.Arc;
import com.kolaps.cfgpetri.net.PetriNet;
import com.kolaps.cfgpetri.net.Place;
import com.kolaps.cfgpetri.net.Transition;
import org.apache.axiom.om.OMAbstractFactory;
import org.apache.axiom.om.OMElement;
import org.apache.axiom.om.OMFactory;
import org.apache.axiom.om.OMNamespace;

import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.io.OutputStream;

/**
 * PNML (P/T-сеть по грамматике 2009 года), собранный через Axiom.
 */
public class PnmlExporter implements PetriNetExporter {

    public static final String PNML_NAMESPACE = "http://www.pnml.org/version-2009/grammar/pnml";
    public static final String PTNET_TYPE = "http://www.pnml.org/version-2009/grammar/ptnet";

    private static final String NET_ID = "net";
    private static final String PAGE_ID = "page0";

    @Override
    public void export(PetriNet net, OutputStream out) throws IOException {
        OMElement root = toDocument(net);
        try {
            root.serialize(out);
        } catch (XMLStreamException e) {
            throw new IOException("Не удалось записать PNML", e);
        }
        out.flush();
    }

    /**
     * Строит корневой элемент {@code <pnml>} для сети.
     */
    public OMElement toDocument(PetriNet net) {
        OMFactory factory = OMAbstractFactory.getOMFactory();
        OMNamespace ns = factory.createOMNamespace(PNML_NAMESPACE, "");

        OMElement pnml = factory.createOMElement("pnml", ns);
        OMElement netElement = factory.createOMElement("net", ns, pnml);
        netElement.addAttribute("id", NET_ID, null);
        netElement.addAttribute("type", PTNET_TYPE, null);
        addName(factory, ns, netElement, NET_ID);
        OMElement page = factory.createOMElement("page", ns, netElement);
        page.addAttribute("id", PAGE_ID, null);

        for (Place place : net.getPlaces()) {
            OMElement element = factory.createOMElement("place", ns, page);
            element.addAttribute("id", place.getLabel(), null);
            addName(factory, ns, element, place.getLabel());
            if (place.isMarked()) {
                addTextChild(factory, ns, element, "initialMarking", String.valueOf(place.getTokens()));
            }
        }
        for (Transition transition : net.getTransitions()) {
            OMElement element = factory.createOMElement("transition", ns, page);
            element.addAttribute("id", transition.getLabel(), null);
            addName(factory, ns, element, transition.getLabel());
        }
        int arcIndex = 0;
        for (Arc arc : net.getArcs()) {
            OMElement element = factory.createOMElement("arc", ns, page);
            element.addAttribute("id", "arc_" + arcIndex++, null);
            element.addAttribute("source", arc.getSource().getLabel(), null);
            element.addAttribute("target", arc.getTarget().getLabel(), null);
            if (arc.getWeight() != 1) {
                addTextChild(factory, ns, element, "inscription", String.valueOf(arc.getWeight()));
            }
        }
        return pnml;
    }

    private static void addName(OMFactory factory, OMNamespace ns, OMElement parent, String name) {
        addTextChild(factory, ns, parent, "name", name);
    }

    // <tag><text>value</text></tag>
    private static void addTextChild(OMFactory factory, OMNamespace ns, OMElement parent, String tag, String value) {
        OMElement element = factory.createOMElement(tag, ns, parent);
        OMElement text = factory.createOMElement("text", ns, element);
        text.setText(value);
    }
}
