package com.demoAuto.salesAgent.orchestrator.prompt;

/**
 * System prompt for general questions, grounded in knowledge-base sections.
 */
public class GeneralAnswerPrompt {

    private GeneralAnswerPrompt() {}

    private static final String SYSTEM_PROMPT_TEMPLATE = """
            You are a customer service agent for a used-car dealership.
            Answer ONLY with information from the company information below.
            If the answer is not there, say you do not have that information and offer to help with something else.
            If the customer asks about specific cars, invite them to tell you the make or model they are interested in.
            Be friendly, concise and professional.

            COMPANY INFORMATION:
            %s""";

    public static final String NO_CONTEXT = "(no company information available right now)";

    public static String systemPrompt(String knowledgeContext) {
        return String.format(SYSTEM_PROMPT_TEMPLATE,
                knowledgeContext == null || knowledgeContext.isBlank() ? NO_CONTEXT : knowledgeContext);
    }
}
