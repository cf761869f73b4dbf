package com.demoAuto.salesAgent.knowledge.model;

import lombok.Value;

/**
 * One titled section of the company knowledge base.
 */
@Value
public class KnowledgeSection {

    String title;
    String body;

    /**
     * Text used both for embedding and as grounding context.
     */
    public String text() {
        return body.isBlank() ? title : title + "\n" + body;
    }
}
