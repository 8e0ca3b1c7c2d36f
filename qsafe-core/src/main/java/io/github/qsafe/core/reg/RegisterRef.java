package io.github.qsafe.core.reg;

import java.util.Objects;

/**
 * A version of a register: the register's contents at one point in program order.
 * <p>
 * Identity is the pair of {@link #registerId} and {@link #version}. The {@link #path}
 * only records where a copy came from, for naming.
 */
public final class RegisterRef {
    public final int registerId;
    public final int version;
    public final String path;
    public final int width;

    public RegisterRef(int registerId, int version, String path, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
        this.registerId = registerId;
        this.version = version;
        this.path = Objects.requireNonNull(path, "path");
        this.width = width;
    }

    /**
     * Get the next version of this register, as produced by an in-place operation.
     *
     * @return The next version.
     */
    public RegisterRef next() {
        return new RegisterRef(registerId, version + 1, path, width);
    }

    /**
     * Get a name for the value in this version, for variables.
     *
     * @return The name.
     */
    public String toVarName() {
        String name = "q" + registerId + "v" + version;
        return path.isEmpty() ? name : name + "_" + path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RegisterRef that = (RegisterRef) o;
        return registerId == that.registerId && version == that.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(registerId, version);
    }

    @Override
    public String toString() {
        return "(" + registerId + ", " + version + (path.isEmpty() ? "" : ", " + path) + ")";
    }
}
