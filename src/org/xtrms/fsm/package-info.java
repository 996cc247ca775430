/*
 * @LICENSE@
 */

/**
 * <h3><b>xtrms-fsm</b> - finite automata over arbitrary ordered alphabets.</h3>
 * <p>
 * <h4>Overview.</h4>
 * <p>
 * Sets of actions are represented as {@link org.xtrms.fsm.Filter}s: sorted
 * unions of disjoint, non-touching inclusive {@link org.xtrms.fsm.Range}s.
 * The order over actions, and whether the actions are discrete, is supplied
 * by an {@link org.xtrms.fsm.Alphabet}; {@link org.xtrms.fsm.Alphabets} has
 * the common ones. Filters support union, difference, intersection and
 * <i>atomization</i>: the partition of several overlapping filters into the
 * coarsest disjoint refinement.
 * <p>
 * An {@link org.xtrms.fsm.NFA} is a directed multigraph over integer states
 * whose edges are either epsilon edges or guarded by a filter. A
 * {@link org.xtrms.fsm.DFA} is determinized from an NFA by subset
 * construction. Before the successors of a set of NFA states are computed the
 * guards leaving the set are atomized, so the edges of the resulting DFA are
 * disjoint per state - determinism is a property of the construction, not a
 * check after the fact. DFAs can also be assembled by hand.
 * <p>
 * Both automata fulfil the {@link org.xtrms.fsm.Automaton} contract and can
 * be stepped through with an {@link org.xtrms.fsm.Evaluator}. Both are
 * {@link org.xtrms.fsm.TransitionGraph}s, which is all
 * {@link org.xtrms.fsm.Graphviz} needs to render them.
 * <p>
 * <h4>Example.</h4>
 * <pre>
 * Alphabet&lt;Character&gt; cs = Alphabets.CHARACTERS;
 * NFA&lt;Character&gt; nfa = new NFA&lt;Character&gt;();
 * nfa.addTransition(0, cs.filter('-'), 1);
 * nfa.addTransition(0, 1);
 * nfa.addTransition(1, cs.range('0', '9'), 2);
 * nfa.addTransition(2, cs.range('0', '9'), 2);
 * nfa.setAcceptingStates(2);
 *
 * Evaluator&lt;Integer, Character&gt; e = Evaluator.of(new DFA&lt;Character&gt;(nfa));
 * e.perform('-'); e.perform('4'); e.perform('2');
 * assert e.accepted();
 * </pre>
 * <p>
 * <h4>Threading.</h4>
 * Nothing is synchronized. Build an automaton on one thread, then share it
 * read-only with any number of evaluators.
 * <p>
 * <h4>Logging.</h4>
 * All classes log to the <code>java.util.logging</code> logger
 * <code>"org.xtrms.fsm"</code>: conflicting hand-built DFA transitions at
 * WARNING, ignored empty-filter transitions at FINE. Determinization dumps
 * the source NFA at FINER and the resulting DFA at FINEST.
 */
package org.xtrms.fsm;
