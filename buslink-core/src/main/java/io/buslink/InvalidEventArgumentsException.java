package io.buslink;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Thrown when the keyword arguments supplied to an event do not match the event's
 * declared parameter names exactly.
 *
 * <p>Both argument sets are kept (sorted) so callers can see what was missing or extra.
 */
public class InvalidEventArgumentsException extends BusException {
    private final SortedSet<String> suppliedNames;
    private final SortedSet<String> expectedNames;

    public InvalidEventArgumentsException(Set<String> suppliedNames, Set<String> expectedNames) {
        super(describe(new TreeSet<>(suppliedNames), new TreeSet<>(expectedNames)));
        this.suppliedNames = new TreeSet<>(suppliedNames);
        this.expectedNames = new TreeSet<>(expectedNames);
    }

    public SortedSet<String> suppliedNames() {
        return new TreeSet<>(suppliedNames);
    }

    public SortedSet<String> expectedNames() {
        return new TreeSet<>(expectedNames);
    }

    public int suppliedCount() {
        return suppliedNames.size();
    }

    public int expectedCount() {
        return expectedNames.size();
    }

    private static String describe(SortedSet<String> supplied, SortedSet<String> expected) {
        return "Invalid event arguments supplied when firing event. Attempted to fire event with "
                + supplied.size() + " arguments: " + supplied
                + ". Event expected " + expected.size() + ": " + expected;
    }
}
