package com.ryuqq.temporal.testkit.assertion;

import org.assertj.core.api.AbstractAssert;

import java.util.Objects;

/**
 * Base assertion shared by the temporal value types.
 *
 * <p>Every value type exposes a canonical string ({@code toString()}) and a debug
 * form ({@code %#s}); both are checked here so the per-type assertions only deal
 * with components.</p>
 *
 * @param <SELF> the concrete assertion type
 * @param <ACTUAL> the value type under test
 *
 * @author Temporal Types Team
 * @since 1.0.0
 */
public abstract class AbstractTemporalAssert<SELF extends AbstractTemporalAssert<SELF, ACTUAL>, ACTUAL>
        extends AbstractAssert<SELF, ACTUAL> {

    protected AbstractTemporalAssert(ACTUAL actual, Class<?> selfType) {
        super(actual, selfType);
    }

    /**
     * Verifies the canonical string form.
     *
     * @param expected the expected canonical text
     * @return this assertion
     */
    public SELF hasCanonicalForm(String expected) {
        isNotNull();
        String text = actual.toString();
        if (!Objects.equals(text, expected)) {
            failWithMessage("Expected canonical form to be <%s> but was <%s>", expected, text);
        }
        return myself;
    }

    /**
     * Verifies the {@code %#s} debug form, {@code TypeName [ canonical ]}.
     *
     * @return this assertion
     */
    public SELF hasDebugFormWrappingCanonical() {
        isNotNull();
        String expected = actual.getClass().getSimpleName() + " [ " + actual + " ]";
        String debug = String.format("%#s", actual);
        if (!expected.equals(debug)) {
            failWithMessage("Expected debug form to be <%s> but was <%s>", expected, debug);
        }
        return myself;
    }

    /**
     * Verifies that the value and {@code other} are equal and render identically.
     *
     * @param other the value to compare with
     * @return this assertion
     */
    public SELF isEquivalentTo(ACTUAL other) {
        isNotNull();
        if (!actual.equals(other)) {
            failWithMessage("Expected <%s> to equal <%s>", actual, other);
        }
        if (actual.hashCode() != other.hashCode()) {
            failWithMessage("Expected <%s> and <%s> to share a hash code", actual, other);
        }
        return hasCanonicalForm(other.toString());
    }

    protected void checkComponent(String name, long expected, long value) {
        if (expected != value) {
            failWithMessage("Expected %s of <%s> to be <%s> but was <%s>", name, actual, expected, value);
        }
    }
}
