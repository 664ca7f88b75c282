package com.williamcallahan.lawlens.domain.navigation;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import java.util.List;

/**
 * Immutable snapshot of a citation viewer session.
 *
 * @param sources current answer's sources
 * @param activeIndex zero-based index of the active source, 0 when none was activated; it only
 *     follows {@code activeCitationNumber} when that number is within the source list
 * @param activeCitationNumber 1-indexed number of the active citation as reported by the caller,
 *     null when none; an out-of-range number keeps the previous {@code activeIndex}
 * @param activeSource active source, null when none
 * @param viewerOpen whether the single-citation view is showing
 * @param compareMode whether the side-by-side view is showing
 * @param compareSelections selected citation numbers, oldest first, at most two
 * @param canGoNext whether {@code next} would move
 * @param canGoPrevious whether {@code previous} would move
 * @param expansions expansion state of every visible citation
 */
public record NavigationState(
        List<ChatSource> sources,
        int activeIndex,
        Integer activeCitationNumber,
        ChatSource activeSource,
        boolean viewerOpen,
        boolean compareMode,
        List<Integer> compareSelections,
        boolean canGoNext,
        boolean canGoPrevious,
        List<CitationExpansion> expansions) {

    public NavigationState {
        sources = sources == null ? List.of() : List.copyOf(sources);
        compareSelections = compareSelections == null ? List.of() : List.copyOf(compareSelections);
        expansions = expansions == null ? List.of() : List.copyOf(expansions);
    }
}
