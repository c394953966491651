package org.dxworks.codeshaper.refactoring;

import org.dxworks.codeshaper.model.SuggestionType;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

public class SuggestionOptions {

    private static final SuggestionOptions ALL = new SuggestionOptions(EnumSet.allOf(SuggestionType.class), Integer.MAX_VALUE);

    private final Set<SuggestionType> focusAreas;
    private final int maxSuggestions;

    private SuggestionOptions(Set<SuggestionType> focusAreas, int maxSuggestions) {
        this.focusAreas = focusAreas;
        this.maxSuggestions = maxSuggestions;
    }

    public static SuggestionOptions all() {
        return ALL;
    }

    /**
     * @param focusAreas suggestion types to keep; empty or null keeps every type
     * @param maxSuggestions limit applied after ordering; zero or negative means unlimited
     */
    public static SuggestionOptions of(Collection<SuggestionType> focusAreas, int maxSuggestions) {
        Set<SuggestionType> areas = (focusAreas == null || focusAreas.isEmpty())
                ? EnumSet.allOf(SuggestionType.class)
                : EnumSet.copyOf(focusAreas);
        return new SuggestionOptions(areas, maxSuggestions > 0 ? maxSuggestions : Integer.MAX_VALUE);
    }

    /**
     * Parses the command-line focus value: {@code all} or one suggestion type name.
     */
    public static SuggestionOptions forArea(String area, int maxSuggestions) {
        if (area == null || area.isBlank() || "all".equalsIgnoreCase(area.trim())) {
            return of(null, maxSuggestions);
        }
        return of(EnumSet.of(SuggestionType.fromName(area)), maxSuggestions);
    }

    public boolean accepts(SuggestionType type) {
        return focusAreas.contains(type);
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }
}
