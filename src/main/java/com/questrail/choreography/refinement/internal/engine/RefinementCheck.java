package com.questrail.choreography.refinement.internal.engine;

import com.questrail.choreography.api.Label;
import com.questrail.choreography.api.Removal;
import com.questrail.choreography.api.UnresolvedLabelException;
import com.questrail.choreography.core.BitSetRefinementRelation;
import com.questrail.choreography.mapping.ArrayLabelIndex;
import com.questrail.choreography.refinement.RefinementResult;
import com.questrail.choreography.refinement.cfa.CfaBuilder;
import com.questrail.choreography.refinement.cfa.ControlFlowAutomaton;
import com.questrail.choreography.refinement.config.RefinementConfig;
import com.questrail.choreography.refinement.observability.CheckStartedEvent;
import com.questrail.choreography.refinement.observability.PassCompletedEvent;
import com.questrail.choreography.refinement.observability.RefinementObservabilitySink;
import com.questrail.choreography.refinement.observability.VerdictEvent;
import com.questrail.choreography.refinement.oracle.CachingImplicationOracle;
import com.questrail.choreography.refinement.oracle.ImplicationOracle;
import com.questrail.choreography.refinement.program.ProgramLabels;
import com.questrail.choreography.refinement.projection.Projection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RefinementCheck
 * -----------------------------------------------------------------------------
 * One run of the greatest-fixpoint computation of the refinement relation.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Relate every program point to every projection state</li>
 *   <li>Pass: snapshot the relation, evaluate every remaining pair against the
 *       snapshot with {@link CompatibilityRules}, remove the failing pairs</li>
 *   <li>Repeat until a pass removes nothing</li>
 *   <li>The program refines the projection iff the start state is still
 *       related to the root</li>
 * </ol>
 * The relation only shrinks, so at most {@code |L|·|S|} pairs are ever
 * removed and the loop runs at most {@code |L|·|S| + 1} passes.
 *
 * <h2>Ownership</h2>
 * A check owns its relation and its implication cache; both are discarded with
 * it. Program, projection and automaton are only read. A check is single-use
 * and not thread-safe.
 */
public final class RefinementCheck
{
    private final ProgramLabels program;
    private final Projection projection;
    private final RefinementConfig config;
    private final RefinementObservabilitySink sink;
    private final CachingImplicationOracle oracle;

    private boolean used;

    public RefinementCheck(ProgramLabels program,
                           Projection projection,
                           ImplicationOracle oracle,
                           RefinementConfig config) {
        this.program = Objects.requireNonNull(program, "program");
        this.projection = Objects.requireNonNull(projection, "projection");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
        this.oracle = new CachingImplicationOracle(Objects.requireNonNull(oracle, "oracle"), sink);
    }

    public RefinementResult run() {
        if (used) {
            throw new IllegalStateException("a RefinementCheck runs only once");
        }
        used = true;

        Label start = projection.startState();
        if (!projection.states().contains(start)) {
            throw new UnresolvedLabelException(start, "start state " + start + " is not a projection state");
        }

        ControlFlowAutomaton cfa = CfaBuilder.build(program);
        sink.onCheckStarted(new CheckStartedEvent(program, projection, cfa));

        CompatibilityRules rules = new CompatibilityRules(program, projection, cfa, oracle, config.nameConvention());
        BitSetRefinementRelation compat = BitSetRefinementRelation.universal(
                new ArrayLabelIndex(program.labels()),
                new ArrayLabelIndex(projection.states()));

        List<Removal> trace = new ArrayList<>();
        int passes = 0;
        long evaluations = 0;
        int removals = 0;
        boolean changed = true;
        while (changed) {
            passes++;
            BitSetRefinementRelation snapshot = compat.snapshot();
            List<Removal> removed = new ArrayList<>();
            for (Label point : program.labels()) {
                for (Label state : snapshot.statesOf(point)) {
                    evaluations++;
                    if (!rules.compatible(program.nodeAt(point), state, snapshot)) {
                        compat.remove(point, state);
                        Removal removal = new Removal(passes, point, state);
                        removed.add(removal);
                        sink.onPairRemoved(removal);
                    }
                }
            }
            sink.onPassCompleted(new PassCompletedEvent(passes, snapshot, removed));
            removals += removed.size();
            if (config.recordTrace()) {
                trace.addAll(removed);
            }
            changed = !removed.isEmpty();
        }

        Label root = program.rootLabel();
        boolean refines = compat.contains(root, start);
        BitSetRefinementRelation finalRelation = compat.snapshot();
        sink.onVerdict(new VerdictEvent(refines, root, start, passes, evaluations, finalRelation));

        return new RefinementResult(refines, root, start, passes, evaluations, removals,
                trace, finalRelation, oracle.stats());
    }
}
