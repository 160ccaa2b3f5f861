package com.panelbridge.config;

import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

/** Shared trust-all {@link SSLContext} for panels configured with {@code verify-ssl: false}. */
public final class TlsSupport {

    private static volatile SSLContext trustAll;

    private TlsSupport() {}

    public static SSLContext trustAllContext() {
        SSLContext context = trustAll;
        if (context == null) {
            synchronized (TlsSupport.class) {
                context = trustAll;
                if (context == null) {
                    context = createTrustAll();
                    trustAll = context;
                }
            }
        }
        return context;
    }

    private static SSLContext createTrustAll() {
        TrustManager[] trustManagers = {
            new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {}

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {}

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            }
        };
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers, new java.security.SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to initialise trust-all TLS context", e);
        }
    }
}
