/* @LICENSE@
 */

package org.xtrms.fsm;

import static org.xtrms.fsm.Misc.LS;

/**
 * Renders any {@link TransitionGraph} in the Graphviz "dot" language, for
 * debugging. Only the public read accessors of the graph are used.
 */
public final class Graphviz {

    private Graphviz() {
    } // never instantiated

    private static final String INDENT = "    ";
    private static final String EPSILON = "ε";

    /**
     * @param name
     *            the name of the digraph
     * @param graph
     *            the automaton to render
     * @return the dot source text
     */
    public static String dot(String name, TransitionGraph<?> graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(Misc.Esc.DOT.esc(name)).append("\" {")
            .append(LS);
        sb.append(INDENT).append("rankdir=LR;").append(LS);
        sb.append(INDENT).append("init [shape=point];").append(LS);
        for (int state : graph.states()) {
            sb.append(INDENT).append(state).append(" [shape=")
                .append(graph.isAccepting(state) ? "doublecircle" : "circle")
                .append("];").append(LS);
        }
        sb.append(INDENT).append("init -> 0;").append(LS);
        for (int state : graph.states()) {
            for (Transition<?> t : graph.transitions(state)) {
                String label = t.isEpsilon() ? EPSILON : t.filter().toString();
                sb.append(INDENT).append(state).append(" -> ")
                    .append(t.destination()).append(" [label=\"")
                    .append(Misc.Esc.DOT.esc(label)).append("\"];").append(LS);
            }
        }
        return sb.append('}').append(LS).toString();
    }
}
