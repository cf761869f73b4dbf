package com.demoAuto.salesAgent.orchestrator.prompt;

/**
 * Prompts used by the finance handler: phrasing a calculated plan, and the fixed
 * replies for missing or invalid input.
 */
public class FinanceResponsePrompt {

    private FinanceResponsePrompt() {}

    public static final String SYSTEM_PROMPT = """
            You are a financing advisor at a used-car dealership.
            Explain the financing plan below to the customer in a natural, friendly way.
            Use ONLY the numbers given, do not recalculate or change any of them.
            Mention the fixed annual rate, no opening fee, and approval within 24 hours.""";

    public static final String ASK_DOWN_PAYMENT = """
            To calculate your financing plan I need the down payment you would like to make.
            For example: "I want to finance a $300,000 car with $60,000 down over 5 years".
            How much would you like to put down?""";

    public static final String ASK_PRICE = """
            To calculate your financing plan I need the price of the car, or the make and model so I can look it up in our catalog.
            For example: "Toyota Corolla with $50,000 down over 4 years".""";

    public static final String RECOVERY = """
            To calculate financing, please tell me:
            - The car price (or make and model)
            - Your down payment
            - The term (3 to 6 years)

            Example: "Car of $250,000, $50,000 down, 4 years\"""";

    private static final String CAR_NOT_FOUND_TEMPLATE = """
            I could not find "%s" in our catalog. Could you tell me the price of the car, or another make and model?
            I already have your down payment of %s.""";

    private static final String DOWN_PAYMENT_EXCEEDS_PRICE_TEMPLATE = """
            Your down payment of %s is higher than the car price of %s.
            Could you confirm the down payment or the price?""";

    public static String userPrompt(String query, String planDescription) {
        return "Customer message: \"" + query + "\"\n\nFINANCING PLAN:\n" + planDescription;
    }

    public static String carNotFound(String carName, String downPayment) {
        return String.format(CAR_NOT_FOUND_TEMPLATE, carName, downPayment);
    }

    public static String downPaymentExceedsPrice(String downPayment, String price) {
        return String.format(DOWN_PAYMENT_EXCEEDS_PRICE_TEMPLATE, downPayment, price);
    }
}
