package io.github.qsafe.core.reg;

import io.github.qsafe.core.UndefinedValueException;
import io.github.qsafe.core.ssa.Effect;
import io.github.qsafe.core.ssa.Insn;
import io.github.qsafe.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The dependency graph of a straight-line quantum-safe function: one node per
 * instruction, in program order, with one edge per operand.
 * <p>
 * The graph describes the function as it was when it was built, and is never updated.
 */
public final class DependencyDag {
    private final List<Node> nodes;
    private final Node returnNode;
    private final Map<Var, Node> producers;

    public DependencyDag(List<Node> nodes, Node returnNode, Map<Var, Node> producers) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.returnNode = returnNode;
        this.producers = producers;
    }

    /**
     * Build the graph of a sequence of effects followed by a return.
     *
     * @param effects The effects.
     * @param ret     The return instruction.
     * @return The graph.
     * @throws UndefinedValueException If an operand is not produced by an earlier effect.
     */
    public static DependencyDag build(List<Effect> effects, Insn ret) {
        List<Node> nodes = new ArrayList<>();
        Map<Var, Node> producers = new IdentityHashMap<>();
        for (Effect effect : effects) {
            Node node = new Node(nodes.size(), effect.insn(), effect, operandsOf(effect.insn(), producers));
            nodes.add(node);
            for (Var var : effect.getAssignsTo()) {
                producers.put(var, node);
            }
        }
        Node returnNode = new Node(nodes.size(), ret, null, operandsOf(ret, producers));
        return new DependencyDag(nodes, returnNode, producers);
    }

    private static List<Node> operandsOf(Insn insn, Map<Var, Node> producers) {
        List<Node> operands = new ArrayList<>();
        for (Var arg : insn) {
            Node producer = producers.get(arg);
            if (producer == null) {
                throw new UndefinedValueException(arg + " is used by " + insn + " before it is defined");
            }
            operands.add(producer);
        }
        return operands;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public Node getReturnNode() {
        return returnNode;
    }

    @Nullable
    public Node producerOf(Var var) {
        return producers.get(var);
    }

    public static final class Node {
        /**
         * The position of the instruction; the return is positioned after every effect.
         */
        public final int index;
        public final Insn insn;
        @Nullable
        public final Effect effect;
        public final List<Node> operands;
        private final List<Node> users = new ArrayList<>();

        Node(int index, Insn insn, @Nullable Effect effect, List<Node> operands) {
            this.index = index;
            this.insn = insn;
            this.effect = effect;
            this.operands = Collections.unmodifiableList(operands);
            for (Node operand : operands) {
                operand.users.add(this);
            }
        }

        public List<Node> getUsers() {
            return Collections.unmodifiableList(users);
        }

        @Override
        public String toString() {
            return index + ": " + (effect == null ? insn : effect);
        }
    }
}
