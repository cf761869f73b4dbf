package com.demoAuto.salesAgent.orchestrator.prompt;

/**
 * Prompts for classifying a customer message into one intent label.
 */
public class IntentClassificationPrompt {

    private IntentClassificationPrompt() {}

    public static final String SYSTEM_PROMPT = "You are an intent classifier for a used-car dealership assistant. Reply with ONE word.";

    private static final String USER_PROMPT_TEMPLATE = """
            Classify the customer message into exactly ONE of these categories:

            CATEGORIES:
            1. GENERAL - questions about the company, policies, warranty, returns, the buying process, services
            2. CATALOG_SEARCH - looking for specific cars (make, model, year, price, features)
            3. FINANCE_CALCULATION - financing, monthly payments, payment plans, down payments

            Examples:
            - "What warranty do you offer?" -> GENERAL
            - "I want a Honda Civic" -> CATALOG_SEARCH
            - "How much would I pay per month for a $250k car?" -> FINANCE_CALCULATION

            Use the recent conversation only to resolve follow-ups such as "and with 5 years?".

            Recent conversation:
            %s

            Message: "%s"

            Reply ONLY with one word: GENERAL, CATALOG_SEARCH or FINANCE_CALCULATION""";

    public static String userPrompt(String query, String history) {
        return String.format(USER_PROMPT_TEMPLATE, history == null || history.isBlank() ? "(none)" : history, query);
    }
}
