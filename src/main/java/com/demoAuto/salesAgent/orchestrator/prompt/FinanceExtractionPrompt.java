package com.demoAuto.salesAgent.orchestrator.prompt;

/**
 * Prompts for extracting financing parameters as strict JSON.
 */
public class FinanceExtractionPrompt {

    private FinanceExtractionPrompt() {}

    public static final String MISSING = "MISSING";

    public static final String SYSTEM_PROMPT = "You extract numeric parameters. Reply only with valid JSON.";

    private static final String USER_PROMPT_TEMPLATE = """
            Extract the values needed to calculate car financing.

            Recent conversation (use it to fill values the customer already gave):
            %s

            Message: "%s"

            Extract:
            - price: car price in pesos (e.g. 250000)
            - car_name: make and model if the customer names a car instead of a price (e.g. "Toyota Corolla")
            - down_payment: down payment amount in pesos (e.g. 50000)
            - term_years: financing term in years (between 3 and 6)

            Use the literal string "MISSING" for any value that is not present.

            Response format (JSON only):
            {"price": 250000, "car_name": "MISSING", "down_payment": 50000, "term_years": 5}""";

    public static String userPrompt(String query, String history) {
        return String.format(USER_PROMPT_TEMPLATE, history == null || history.isBlank() ? "(none)" : history, query);
    }
}
