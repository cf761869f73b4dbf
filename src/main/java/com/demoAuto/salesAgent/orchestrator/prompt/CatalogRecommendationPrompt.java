package com.demoAuto.salesAgent.orchestrator.prompt;

/**
 * System prompt for recommending cars from a fixed context block.
 */
public class CatalogRecommendationPrompt {

    private CatalogRecommendationPrompt() {}

    public static final String NO_MATCHES = "No cars matched the request. Suggest that the customer broaden the search (another make, model, year or budget).";

    private static final String SYSTEM_PROMPT_TEMPLATE = """
            You are an expert salesperson at a used-car dealership. Your job is to recommend cars from the catalog below.

            CATALOG:
            %s

            RULES:
            - Recommend ONLY cars listed in the catalog above, never invent cars, prices or mileage
            - Highlight price, mileage and year
            - If nothing matches exactly, offer the closest alternatives from the list
            - Be persuasive but honest
            - Mention that every car includes a warranty and a 7-day trial period""";

    public static String systemPrompt(String catalogContext) {
        return String.format(SYSTEM_PROMPT_TEMPLATE, catalogContext);
    }
}
