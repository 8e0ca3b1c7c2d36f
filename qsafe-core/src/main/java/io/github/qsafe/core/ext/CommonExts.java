package io.github.qsafe.core.ext;

import io.github.qsafe.core.reg.DependencyDag;
import io.github.qsafe.core.reg.Expr;
import io.github.qsafe.core.reg.RegisterRef;
import io.github.qsafe.core.reg.RegisterTimeline;
import io.github.qsafe.core.ssa.*;

import java.util.Map;

public class CommonExts {
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");

    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * The register slot a quantum-safe value lives in.
     */
    public static final Ext<RegisterRef> REGISTER = Ext.create(RegisterRef.class, "REGISTER");
    /**
     * The expression a quantum-safe value can be recomputed from.
     */
    public static final Ext<Expr> DEFINITION = Ext.create(Expr.class, "DEFINITION");

    /**
     * For a translated function, the quantum-safe value each classical value was last held in.
     */
    public static final Ext<Map<Var, Var>> VALUE_MAP = Ext.create(Map.class, "VALUE_MAP");

    public static final Ext<CodeType> CODE_TYPE = Ext.create(CodeType.class, "CODE_TYPE");

    public static final Ext<DependencyDag> DEPENDENCY_DAG = Ext.create(DependencyDag.class, "DEPENDENCY_DAG");
    public static final Ext<RegisterTimeline> REGISTER_TIMELINE = Ext.create(RegisterTimeline.class, "REGISTER_TIMELINE");

    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }

    public static final class CodeType {
        public static final CodeType CLASSICAL = new CodeType("classical");
        public static final CodeType QUANTUM = new CodeType("quantum");

        public final String name;

        public CodeType(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
