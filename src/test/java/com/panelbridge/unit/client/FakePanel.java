package com.panelbridge.unit.client;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelResponse;
import com.panelbridge.session.PanelSessionManager;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Routes requests sent through a mocked {@link PanelSessionManager} to canned answers keyed by
 * {@code "METHOD /path"}, and records every request. Unrouted requests answer {@code {}}.
 */
class FakePanel {

    private final Map<String, Function<PanelRequest, PanelResponse>> routes = new ConcurrentHashMap<>();
    private final List<PanelRequest> requests = new CopyOnWriteArrayList<>();

    static FakePanel attachTo(PanelSessionManager sessionManager) {
        FakePanel panel = new FakePanel();
        when(sessionManager.execute(any())).thenAnswer(invocation -> panel.handle(invocation.getArgument(0)));
        return panel;
    }

    FakePanel on(String route, String json) {
        routes.put(route, request -> new PanelResponse(200, json));
        return this;
    }

    FakePanel on(String route, Function<PanelRequest, PanelResponse> handler) {
        routes.put(route, handler);
        return this;
    }

    List<PanelRequest> requests() {
        return requests;
    }

    List<PanelRequest> requests(String route) {
        return requests.stream().filter(r -> key(r).equals(route)).collect(Collectors.toList());
    }

    String bodyOf(PanelRequest request) {
        return JsonHelper.toJson(request.getBody());
    }

    private PanelResponse handle(PanelRequest request) {
        requests.add(request);
        Function<PanelRequest, PanelResponse> handler = routes.get(key(request));
        return handler != null ? handler.apply(request) : new PanelResponse(200, "{}");
    }

    private static String key(PanelRequest request) {
        return request.getMethod() + " " + request.getPath();
    }
}
