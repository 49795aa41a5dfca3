package io.hearthwarrio.ariaindex.core;

import java.util.Objects;

/**
 * Disambiguated (role, name, nth) triple that an interaction layer turns into a concrete locator.
 * <p>
 * {@code nth} is zero-based and {@code null} when the (role, name) pair needs no disambiguation.
 */
public final class RefTarget {

    private final String role;
    private final String name;
    private final Integer nth;

    public RefTarget(String role, String name, Integer nth) {
        this.role = Objects.requireNonNull(role, "role must not be null");
        this.name = name;
        this.nth = nth;
    }

    public String getRole() {
        return role;
    }

    /**
     * Accessible name, or {@code null} for role-only targets.
     */
    public String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null && !name.isEmpty();
    }

    /**
     * Zero-based disambiguation index, or {@code null}.
     */
    public Integer getNth() {
        return nth;
    }

    /**
     * Human-readable locator description, e.g. {@code getByRole("button", { name: "Save", exact: true })}.
     * Named {@code text} targets are located by their text: {@code getByText("Terms", { exact: true })}.
     */
    public String selector() {
        if (hasName()) {
            String escaped = name.replace("\"", "\\\"");
            if (NodeText.TEXT_ROLE.equals(role)) {
                return "getByText(\"" + escaped + "\", { exact: true })";
            }
            return "getByRole(\"" + role + "\", { name: \"" + escaped + "\", exact: true })";
        }
        return "getByRole(\"" + role + "\")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RefTarget)) return false;
        RefTarget that = (RefTarget) o;
        return Objects.equals(role, that.role) &&
                Objects.equals(name, that.name) &&
                Objects.equals(nth, that.nth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, name, nth);
    }

    @Override
    public String toString() {
        return "RefTarget{" +
                "role='" + role + '\'' +
                ", name=" + (name == null ? "null" : "'" + name + "'") +
                ", nth=" + nth +
                '}';
    }
}
