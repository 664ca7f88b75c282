package com.williamcallahan.lawlens.service.navigation;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.navigation.CitationExpansion;
import com.williamcallahan.lawlens.domain.navigation.NavigationState;
import com.williamcallahan.lawlens.domain.retrieval.ExpandedView;
import com.williamcallahan.lawlens.domain.retrieval.ExpansionKey;
import com.williamcallahan.lawlens.service.retrieval.SectionExpansionService;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

/**
 * Active-citation and compare state for one citation viewer session.
 *
 * <p>Every surface of the session (inline markers, hover previews, the detail view, the compare
 * view) reads and mutates this one object. Operations are serialized on the instance monitor.
 * Expansion fetches are started for whatever is visible and their results are applied only if
 * the citation is still visible and the source list has not been replaced since the fetch
 * began; anything else is discarded.</p>
 */
public class CitationNavigator {
    private static final Logger logger = LoggerFactory.getLogger(CitationNavigator.class);

    static final int MAX_COMPARE_SELECTIONS = 2;

    private final String sessionId;
    private final SectionExpansionService expansionService;

    private List<ChatSource> sources = List.of();
    private int activeIndex;
    private Integer activeCitationNumber;
    private ChatSource activeSource;
    private boolean viewerOpen;
    private boolean compareMode;
    private final List<Integer> compareSelections = new ArrayList<>();

    private long generation;
    private final Map<ExpansionKey, PendingFetch> inFlight = new HashMap<>();
    private final Map<ExpansionKey, ExpandedView> expansions = new HashMap<>();

    public CitationNavigator(String sessionId, SectionExpansionService expansionService) {
        this.sessionId = sessionId;
        this.expansionService = expansionService;
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Replaces the source list for a new answer and resets all navigation state.
     *
     * @param newSources sources in citation order
     */
    public synchronized void replaceSources(List<ChatSource> newSources) {
        cancelAllFetches();
        generation++;
        sources = newSources == null ? List.of() : List.copyOf(newSources);
        activeIndex = 0;
        activeCitationNumber = null;
        activeSource = null;
        viewerOpen = false;
        compareMode = false;
        compareSelections.clear();
        expansions.clear();
        logger.debug("Session {} now holds {} sources (generation {})", sessionId, sources.size(), generation);
    }

    /**
     * Makes a citation active without opening the detail view.
     *
     * @param source cited source
     * @param citationNumber 1-indexed number; the index is synced only when it is in range
     */
    public synchronized void activate(ChatSource source, int citationNumber) {
        activeSource = source;
        activeCitationNumber = citationNumber;
        if (citationNumber >= 1 && citationNumber <= sources.size()) {
            activeIndex = citationNumber - 1;
        }
        syncFetches();
    }

    /**
     * Activates a citation and opens the single-citation view, leaving compare mode.
     *
     * @param source cited source
     * @param citationNumber 1-indexed number
     */
    public synchronized void open(ChatSource source, int citationNumber) {
        activeSource = source;
        activeCitationNumber = citationNumber;
        if (citationNumber >= 1 && citationNumber <= sources.size()) {
            activeIndex = citationNumber - 1;
        }
        viewerOpen = true;
        compareMode = false;
        syncFetches();
    }

    /**
     * Re-opens the last active citation; does nothing when none was ever activated.
     */
    public synchronized void open() {
        if (activeSource == null) {
            return;
        }
        viewerOpen = true;
        compareMode = false;
        syncFetches();
    }

    /**
     * Hides the single-citation view, keeping the active selection for a later re-open.
     */
    public synchronized void close() {
        viewerOpen = false;
        syncFetches();
    }

    public synchronized void next() {
        if (activeIndex < sources.size() - 1) {
            moveTo(activeIndex + 1);
        }
    }

    public synchronized void previous() {
        if (activeIndex > 0 && !sources.isEmpty()) {
            moveTo(activeIndex - 1);
        }
    }

    /**
     * Jumps to a source index, clamped into range.
     *
     * @param index zero-based index
     */
    public synchronized void goToIndex(int index) {
        if (sources.isEmpty()) {
            return;
        }
        moveTo(Math.max(0, Math.min(index, sources.size() - 1)));
    }

    /**
     * Applies a keyboard shortcut while the single view is open.
     *
     * <p>{@code j}/{@code ArrowRight} move forward, {@code k}/{@code ArrowLeft} move back,
     * {@code Escape} closes and {@code 1}-{@code 9} jump to that citation when it exists.</p>
     *
     * @param key key name as reported by the browser
     * @param focusInTextField whether focus is in an editable field
     * @return true when the key was consumed
     */
    public synchronized boolean handleKey(String key, boolean focusInTextField) {
        if (!viewerOpen || focusInTextField || key == null) {
            return false;
        }
        switch (key) {
            case "j", "ArrowRight" -> next();
            case "k", "ArrowLeft" -> previous();
            case "Escape" -> close();
            default -> {
                if (key.length() != 1 || key.charAt(0) < '1' || key.charAt(0) > '9') {
                    return false;
                }
                int citationNumber = key.charAt(0) - '0';
                if (citationNumber > sources.size()) {
                    return false;
                }
                moveTo(citationNumber - 1);
            }
        }
        return true;
    }

    /**
     * Switches to the side-by-side view, closing the single view.
     */
    public synchronized void enterCompareMode() {
        viewerOpen = false;
        compareMode = true;
        syncFetches();
    }

    public synchronized void exitCompareMode() {
        compareMode = false;
        syncFetches();
    }

    /**
     * Toggles a citation in the compare selection. With two already selected, the oldest is
     * evicted to make room. Numbers outside the source list are ignored.
     *
     * @param citationNumber 1-indexed number
     */
    public synchronized void toggleCompareSelection(int citationNumber) {
        if (citationNumber < 1 || citationNumber > sources.size()) {
            return;
        }
        Integer number = citationNumber;
        if (!compareSelections.remove(number)) {
            if (compareSelections.size() >= MAX_COMPARE_SELECTIONS) {
                compareSelections.remove(0);
            }
            compareSelections.add(number);
        }
        syncFetches();
    }

    /**
     * Cancels every pending fetch; called when the session is discarded.
     */
    public synchronized void discard() {
        cancelAllFetches();
        generation++;
        viewerOpen = false;
        compareMode = false;
        logger.debug("Session {} discarded", sessionId);
    }

    public synchronized NavigationState snapshot() {
        List<CitationExpansion> visibleExpansions = new ArrayList<>();
        visibleCitations().forEach((key, citationNumber) -> visibleExpansions.add(
                new CitationExpansion(citationNumber, key, inFlight.containsKey(key), expansions.get(key))));
        return new NavigationState(
                sources,
                activeIndex,
                activeCitationNumber,
                activeSource,
                viewerOpen,
                compareMode,
                compareSelections,
                activeIndex < sources.size() - 1,
                activeIndex > 0 && !sources.isEmpty(),
                visibleExpansions);
    }

    private void moveTo(int index) {
        activeIndex = index;
        activeSource = sources.get(index);
        activeCitationNumber = index + 1;
        syncFetches();
    }

    /**
     * Citations currently on screen, keyed by expansion key, in display order.
     */
    private Map<ExpansionKey, Integer> visibleCitations() {
        Map<ExpansionKey, Integer> visible = new LinkedHashMap<>();
        if (viewerOpen && activeSource != null) {
            visible.put(ExpansionKey.of(activeSource), activeCitationNumber);
        }
        if (compareMode) {
            for (Integer number : compareSelections) {
                visible.putIfAbsent(ExpansionKey.of(sources.get(number - 1)), number);
            }
        }
        return visible;
    }

    private ChatSource sourceFor(int citationNumber) {
        if (viewerOpen && activeSource != null && activeCitationNumber != null && activeCitationNumber == citationNumber) {
            return activeSource;
        }
        return sources.get(citationNumber - 1);
    }

    /**
     * Starts fetches for newly visible citations and cancels fetches whose view went away.
     * Fallback results are forgotten once hidden so re-opening retries.
     */
    private void syncFetches() {
        Map<ExpansionKey, Integer> visible = visibleCitations();

        inFlight.entrySet().removeIf(entry -> {
            if (visible.containsKey(entry.getKey())) {
                return false;
            }
            entry.getValue().cancel();
            logger.debug("Session {} cancelled fetch for hidden citation {}", sessionId, entry.getKey());
            return true;
        });
        expansions.entrySet().removeIf(entry -> !visible.containsKey(entry.getKey()) && !entry.getValue().isExpanded());

        visible.forEach((key, citationNumber) -> {
            if (expansions.containsKey(key) || inFlight.containsKey(key)) {
                return;
            }
            startFetch(key, sourceFor(citationNumber));
        });
    }

    private void startFetch(ExpansionKey key, ChatSource source) {
        PendingFetch pending = new PendingFetch(generation);
        inFlight.put(key, pending);
        logger.debug("Session {} fetching expansion for {}", sessionId, key);
        pending.subscription = expansionService.expand(source)
                .subscribe(view -> applyExpansion(key, pending, view));
    }

    private synchronized void applyExpansion(ExpansionKey key, PendingFetch pending, ExpandedView view) {
        if (inFlight.get(key) != pending || pending.generation != generation) {
            logger.debug("Session {} discarded stale expansion for {}", sessionId, key);
            return;
        }
        inFlight.remove(key);
        if (!visibleCitations().containsKey(key)) {
            logger.debug("Session {} discarded expansion for hidden citation {}", sessionId, key);
            return;
        }
        expansions.put(key, view);
    }

    private void cancelAllFetches() {
        inFlight.values().forEach(PendingFetch::cancel);
        inFlight.clear();
    }

    /**
     * One in-flight fetch; identity distinguishes it from later fetches of the same key.
     */
    private static final class PendingFetch {
        private final long generation;
        private Disposable subscription;

        PendingFetch(long generation) {
            this.generation = generation;
        }

        void cancel() {
            if (subscription != null) {
                subscription.dispose();
            }
        }
    }
}
