package com.kolaps.cfgpetri.net;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.kolaps.cfgpetri.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Verify.verify;

/**
 * Сеть Петри (место/переход), которая строится один раз и только растет:
 * ни место, ни переход, ни дуга не удаляются после создания.
 * <p>
 * Метки узлов уникальны во всей сети (места и переходы делят одно пространство имен,
 * как идентификаторы в PNML). Повторная метка или дуга к чужому узлу это ошибка транслятора.
 */
public class PetriNet {

    private static final Logger log = LoggerFactory.getLogger(PetriNet.class);

    private final Map<String, Place> places = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final List<Arc> arcs = new ArrayList<>();
    // Индексы дуг по узлам, порядок вставки сохраняется
    private final SetMultimap<Node, Arc> outArcs = LinkedHashMultimap.create();
    private final SetMultimap<Node, Arc> inArcs = LinkedHashMultimap.create();
    private final boolean isDebug;

    public PetriNet() {
        this.isDebug = Options.INSTANCE.getBooleanOption("app.debug", false);
    }

    public Place addPlace(String label) {
        checkLabelIsFree(label);
        Place place = new Place(label);
        places.put(label, place);
        if (isDebug) {
            log.debug("Created Place: {}", label);
        }
        return place;
    }

    public Transition addTransition(String label) {
        checkLabelIsFree(label);
        Transition transition = new Transition(label);
        transitions.put(label, transition);
        if (isDebug) {
            log.debug("Created Transition: {}", label);
        }
        return transition;
    }

    public Arc addArc(Place source, Transition target) {
        return addArc(source, target, 1);
    }

    public Arc addArc(Transition source, Place target) {
        return addArc(source, target, 1);
    }

    public Arc addArc(Place source, Transition target, int weight) {
        return connect(source, target, weight);
    }

    public Arc addArc(Transition source, Place target, int weight) {
        return connect(source, target, weight);
    }

    /**
     * Добавляет фишки в место.
     *
     * @param place место этой сети
     * @param count количество фишек (не отрицательное)
     */
    public void addToken(Place place, int count) {
        checkArgument(count >= 0, "Количество фишек не может быть отрицательным: %s", count);
        checkOwned(place);
        place.setTokens(Math.addExact(place.getTokens(), count));
        if (isDebug) {
            log.debug("Marked Place: {} ({} token(s))", place.getLabel(), place.getTokens());
        }
    }

    private Arc connect(Node source, Node target, int weight) {
        checkArgument(weight > 0, "Вес дуги должен быть положительным: %s", weight);
        checkOwned(source);
        checkOwned(target);
        // Повторная дуга между теми же узлами увеличивает вес существующей
        for (Arc existing : outArcs.get(source)) {
            if (existing.getTarget() == target) {
                existing.increaseWeight(weight);
                return existing;
            }
        }
        Arc arc = new Arc(source, target, weight);
        arcs.add(arc);
        outArcs.put(source, arc);
        inArcs.put(target, arc);
        if (isDebug) {
            log.debug("Created Arc: {}", arc);
        }
        return arc;
    }

    private void checkLabelIsFree(String label) {
        verify(label != null && !label.isEmpty(), "BUG: пустая метка узла");
        verify(!places.containsKey(label) && !transitions.containsKey(label),
                "BUG: метка %s уже используется в сети", label);
    }

    private void checkOwned(Node node) {
        Node owned = node instanceof Place ? places.get(node.getLabel()) : transitions.get(node.getLabel());
        verify(owned == node, "BUG: узел %s не принадлежит этой сети", node);
    }

    public Collection<Place> getPlaces() {
        return Collections.unmodifiableCollection(places.values());
    }

    public Collection<Transition> getTransitions() {
        return Collections.unmodifiableCollection(transitions.values());
    }

    public List<Arc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    public Optional<Place> findPlace(String label) {
        return Optional.ofNullable(places.get(label));
    }

    public Optional<Transition> findTransition(String label) {
        return Optional.ofNullable(transitions.get(label));
    }

    public List<Arc> getOutputArcs(Node node) {
        return ImmutableList.copyOf(outArcs.get(node));
    }

    public List<Arc> getInputArcs(Node node) {
        return ImmutableList.copyOf(inArcs.get(node));
    }

    /**
     * @return входные места перехода в порядке добавления дуг
     */
    public List<Place> getPreset(Transition transition) {
        List<Place> result = new ArrayList<>();
        for (Arc arc : inArcs.get(transition)) {
            result.add((Place) arc.getSource());
        }
        return result;
    }

    /**
     * @return выходные места перехода в порядке добавления дуг
     */
    public List<Place> getPostset(Transition transition) {
        List<Place> result = new ArrayList<>();
        for (Arc arc : outArcs.get(transition)) {
            result.add((Place) arc.getTarget());
        }
        return result;
    }

    /**
     * Начальная маркировка: только места, в которых есть фишки.
     */
    public Map<Place, Integer> getInitialMarking() {
        ImmutableMap.Builder<Place, Integer> marking = ImmutableMap.builder();
        for (Place place : places.values()) {
            if (place.isMarked()) {
                marking.put(place, place.getTokens());
            }
        }
        return marking.build();
    }

    public int placeCount() {
        return places.size();
    }

    public int transitionCount() {
        return transitions.size();
    }

    public int arcCount() {
        return arcs.size();
    }

    @Override
    public String toString() {
        return "PetriNet{places=" + places.size() + ", transitions=" + transitions.size()
                + ", arcs=" + arcs.size() + '}';
    }
}
