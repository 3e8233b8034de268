package com.p6tree.json;

import com.p6tree.match.Match;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Source of a {@link MatchJsonReader} and a {@link MatchJsonWriter} for match
 * trees dumped by a grammar engine.
 *
 * <p>Implementations register themselves under
 * {@code META-INF/services/com.p6tree.json.MatchJsonProvider}; putting
 * p6tree-jackson on the classpath is enough to make one available.</p>
 *
 * <pre>{@code
 * Match root = MatchJsonProvider.getProvider().getReader().read(json);
 * Document document = new Factory().build(root);
 * }</pre>
 */
public interface MatchJsonProvider {

    MatchJsonReader getReader();

    MatchJsonWriter getWriter();

    /**
     * @return the name lookups match against, case-insensitively (e.g. "Jackson")
     */
    String getName();

    /**
     * Shorthand for {@code getReader().read(json)}.
     *
     * @throws MatchJsonException if the document is malformed
     */
    default Match read(String json) throws MatchJsonException {
        return getReader().read(json);
    }

    /**
     * Every provider on the classpath, in the order {@link ServiceLoader} finds them.
     */
    static List<MatchJsonProvider> providers() {
        List<MatchJsonProvider> providers = new ArrayList<>();
        ServiceLoader.load(MatchJsonProvider.class).forEach(providers::add);
        return providers;
    }

    /**
     * @return the first provider found
     * @throws IllegalStateException if there is none
     */
    static MatchJsonProvider getProvider() {
        List<MatchJsonProvider> providers = providers();
        if (providers.isEmpty()) {
            throw new IllegalStateException(
                "No MatchJsonProvider on the classpath; add p6tree-jackson or another provider");
        }
        return providers.get(0);
    }

    /**
     * @param name a provider name such as "Jackson"
     * @throws IllegalStateException if no provider has that name
     */
    static MatchJsonProvider getProvider(String name) {
        for (MatchJsonProvider provider : providers()) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No MatchJsonProvider named '" + name + "' on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(MatchJsonProvider.class).findFirst().isPresent();
    }
}
