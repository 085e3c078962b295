package com.trender.pipeline.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * Result of probing a repository for a {@code render.yaml} marker file.
 *
 * @param usesRender         whether the marker file was found and read
 * @param category           project category, {@code null} when not in use
 * @param services           declared service types, in file order
 * @param databases          declared database types, in file order
 * @param serviceCount       services plus databases
 * @param complexityScore    0-10 deployment complexity
 * @param hasBlueprintButton whether the README links a Render deploy button
 */
public record RenderUsage(
        boolean usesRender,
        RenderCategory category,
        List<String> services,
        List<String> databases,
        int serviceCount,
        int complexityScore,
        boolean hasBlueprintButton
) {

    private static final RenderUsage NOT_IN_USE =
            new RenderUsage(false, null, List.of(), List.of(), 0, 0, false);

    public RenderUsage {
        services = services == null ? List.of() : List.copyOf(services);
        databases = databases == null ? List.of() : List.copyOf(databases);
    }

    public static RenderUsage notInUse() {
        return NOT_IN_USE;
    }

    /**
     * Declared service and database types together, the keys of the usage fact table.
     */
    public List<String> allServiceTypes() {
        if (databases.isEmpty()) {
            return services;
        }
        return Stream.concat(services.stream(), databases.stream()).toList();
    }

    public RenderUsage withBlueprintButton(boolean blueprintButton) {
        if (!usesRender || blueprintButton == hasBlueprintButton) {
            return this;
        }
        return new RenderUsage(true, category, services, databases, serviceCount,
                complexityScore, blueprintButton);
    }
}
