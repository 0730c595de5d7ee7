package com.txt2tex.json;

import java.util.ServiceLoader;

/**
 * Entry point to a JSON binding for the txt2tex tree. Bindings register
 * themselves under {@code META-INF/services} and are found with
 * {@link ServiceLoader}, so the core parser never depends on a JSON library.
 *
 * <pre>{@code
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * String text = json.getSerializer().serialize(Parser.parseDocument(source));
 * Document back = json.getDeserializer().deserializeDocument(text);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used to pick a binding when several are present, e.g. "Jackson".
     */
    String getName();

    /**
     * @throws IllegalStateException if no binding is on the classpath
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No AstJsonProvider on the classpath; add txt2tex-jackson to the dependencies"));
    }

    /**
     * @throws IllegalStateException if no binding with that name (ignoring case) is present
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
