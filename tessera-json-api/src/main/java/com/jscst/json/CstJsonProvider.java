package com.jscst.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point to a JSON binding for concrete syntax trees, discovered with
 * {@link ServiceLoader}. Putting tessera-jackson on the classpath registers one.
 *
 * <pre>{@code
 * CstJsonProvider provider = CstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(script);
 * Script copy = provider.getDeserializer().deserializeScript(json);
 * }</pre>
 */
public interface CstJsonProvider {

    CstJsonSerializer getSerializer();

    CstJsonDeserializer getDeserializer();

    /**
     * Short name used to select this provider, e.g. "Jackson".
     */
    String getName();

    /**
     * The first provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static CstJsonProvider getProvider() {
        Iterator<CstJsonProvider> providers = ServiceLoader.load(CstJsonProvider.class).iterator();
        if (providers.hasNext()) {
            return providers.next();
        }
        throw new IllegalStateException(
            "No CstJsonProvider on the classpath; add tessera-jackson or another binding to the dependencies"
        );
    }

    /**
     * The provider whose {@link #getName()} matches {@code name}, ignoring case.
     *
     * @throws IllegalStateException if there is none
     */
    static CstJsonProvider getProvider(String name) {
        for (CstJsonProvider provider : ServiceLoader.load(CstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No CstJsonProvider named '" + name + "' on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(CstJsonProvider.class).iterator().hasNext();
    }
}
