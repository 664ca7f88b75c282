package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.errors.ApiResponse;
import com.williamcallahan.lawlens.domain.navigation.NavigationState;
import com.williamcallahan.lawlens.service.navigation.CitationNavigator;
import com.williamcallahan.lawlens.service.navigation.CitationViewerSessions;
import jakarta.validation.Valid;
import java.util.function.Consumer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Citation viewer session API. Every surface of a viewer (inline markers, hover previews, the
 * detail view and the compare view) drives the same session through these endpoints and
 * renders the returned state.
 */
@RestController
@RequestMapping(value = "/api/viewer/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
public class CitationViewerController extends BaseController {

    private final CitationViewerSessions sessions;

    public CitationViewerController(CitationViewerSessions sessions, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.sessions = sessions;
    }

    @PutMapping(value = "/sources", consumes = MediaType.APPLICATION_JSON_VALUE)
    public NavigationState replaceSources(
            @PathVariable String sessionId, @Valid @RequestBody ReplaceSourcesRequest request) {
        return apply(sessionId, navigator -> navigator.replaceSources(request.sources()));
    }

    @PostMapping(value = "/activate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public NavigationState activate(
            @PathVariable String sessionId, @Valid @RequestBody CitationSelectionRequest request) {
        return apply(sessionId, navigator -> navigator.activate(request.source(), request.citationNumber()));
    }

    /**
     * Opens the single-citation view, either on the given citation or on the last active one
     * when no body is sent.
     *
     * @param sessionId viewer session id
     * @param request citation to open, may be absent
     * @return session state
     */
    @PostMapping("/open")
    public NavigationState open(
            @PathVariable String sessionId, @Valid @RequestBody(required = false) CitationSelectionRequest request) {
        if (request == null) {
            return apply(sessionId, CitationNavigator::open);
        }
        return apply(sessionId, navigator -> navigator.open(request.source(), request.citationNumber()));
    }

    @PostMapping("/close")
    public NavigationState close(@PathVariable String sessionId) {
        return apply(sessionId, CitationNavigator::close);
    }

    @PostMapping("/next")
    public NavigationState next(@PathVariable String sessionId) {
        return apply(sessionId, CitationNavigator::next);
    }

    @PostMapping("/previous")
    public NavigationState previous(@PathVariable String sessionId) {
        return apply(sessionId, CitationNavigator::previous);
    }

    @PostMapping(value = "/goto", consumes = MediaType.APPLICATION_JSON_VALUE)
    public NavigationState goTo(@PathVariable String sessionId, @RequestBody GoToRequest request) {
        return apply(sessionId, navigator -> navigator.goToIndex(request.index()));
    }

    @PostMapping(value = "/key", consumes = MediaType.APPLICATION_JSON_VALUE)
    public KeyResponse key(@PathVariable String sessionId, @Valid @RequestBody KeyRequest request) {
        CitationNavigator navigator = sessions.getOrCreate(sessionId);
        boolean consumed = navigator.handleKey(request.key(), request.focusInTextField());
        return new KeyResponse(consumed, navigator.snapshot());
    }

    @PostMapping("/compare")
    public NavigationState enterCompare(@PathVariable String sessionId) {
        return apply(sessionId, CitationNavigator::enterCompareMode);
    }

    @DeleteMapping("/compare")
    public NavigationState exitCompare(@PathVariable String sessionId) {
        return apply(sessionId, CitationNavigator::exitCompareMode);
    }

    @PostMapping(value = "/compare/toggle", consumes = MediaType.APPLICATION_JSON_VALUE)
    public NavigationState toggleCompare(@PathVariable String sessionId, @RequestBody CompareToggleRequest request) {
        return apply(sessionId, navigator -> navigator.toggleCompareSelection(request.citationNumber()));
    }

    @GetMapping
    public NavigationState state(@PathVariable String sessionId) {
        return sessions.getOrCreate(sessionId).snapshot();
    }

    /**
     * Discards the session when the viewer fully closes.
     *
     * @param sessionId viewer session id
     * @return success, or 404 when the session does not exist
     */
    @DeleteMapping
    public ResponseEntity<ApiResponse> discard(@PathVariable String sessionId) {
        if (!sessions.discard(sessionId)) {
            return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, "Unknown viewer session: " + sessionId);
        }
        return createSuccessResponse("Viewer session discarded");
    }

    private NavigationState apply(String sessionId, Consumer<CitationNavigator> operation) {
        CitationNavigator navigator = sessions.getOrCreate(sessionId);
        operation.accept(navigator);
        return navigator.snapshot();
    }
}
