package com.panelbridge.session;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

/**
 * One panel API call, relative to the configured base URL. {@code body} is serialized as JSON.
 */
@Value
@Builder
public class PanelRequest {

    HttpMethod method;
    String path;

    @Singular
    Map<String, Object> queryParams;

    Object body;

    public static PanelRequestBuilder get(String path) {
        return builder().method(HttpMethod.GET).path(path);
    }

    public static PanelRequestBuilder post(String path, Object body) {
        return builder().method(HttpMethod.POST).path(path).body(body);
    }

    public static PanelRequestBuilder put(String path, Object body) {
        return builder().method(HttpMethod.PUT).path(path).body(body);
    }

    public static PanelRequestBuilder delete(String path) {
        return builder().method(HttpMethod.DELETE).path(path);
    }

    /** GETs can be repeated after a transport failure without side effects on the panel. */
    public boolean isIdempotent() {
        return HttpMethod.GET.equals(method);
    }

    public String describe() {
        return method + " " + path;
    }
}
