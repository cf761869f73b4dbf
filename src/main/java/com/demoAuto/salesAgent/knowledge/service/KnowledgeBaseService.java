package com.demoAuto.salesAgent.knowledge.service;

import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.knowledge.model.KnowledgeSection;
import com.demoAuto.salesAgent.llm.service.EmbeddingClient;
import com.demoAuto.salesAgent.retrieval.EmbeddingRetrieval;
import com.demoAuto.salesAgent.retrieval.Retrieval;
import com.demoAuto.salesAgent.retrieval.RetrievalUnavailableException;
import com.demoAuto.salesAgent.retrieval.ScoredItem;
import com.demoAuto.salesAgent.util.ClasspathResourceLoader;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Company knowledge base used to ground general answers.
 *
 * The source document is split on level-2 headings ({@code ## }); anything before the first
 * heading is treated as the document title and dropped. Sections are embedded once at startup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeBaseService implements Retrieval<KnowledgeSection> {

    private static final String SECTION_MARKER = "## ";

    private final SalesAgentProperties properties;
    private final EmbeddingClient embeddingClient;

    private volatile List<KnowledgeSection> sections = List.of();
    private volatile EmbeddingRetrieval<KnowledgeSection> index;

    @PostConstruct
    public void load() {
        String resource = properties.getKnowledge().getResource();
        try {
            sections = parseSections(ClasspathResourceLoader.loadAsString(resource));
            log.info("Knowledge base loaded - resource: {}, sections: {}", resource, sections.size());
        } catch (IOException e) {
            log.warn("Knowledge base could not be loaded - resource: {}, error: {}", resource, e.getMessage());
            sections = List.of();
            return;
        }

        try {
            index = EmbeddingRetrieval.build(sections, KnowledgeSection::text, embeddingClient);
        } catch (RuntimeException e) {
            log.warn("Knowledge base embeddings unavailable, general answers will run without grounding - error: {}", e.getMessage());
            index = null;
        }
    }

    @Override
    public List<ScoredItem<KnowledgeSection>> topK(String query, int k) {
        EmbeddingRetrieval<KnowledgeSection> current = index;
        if (current == null) {
            throw new RetrievalUnavailableException("Knowledge base index is not available");
        }
        return current.topK(query, k);
    }

    public List<KnowledgeSection> getSections() {
        return sections;
    }

    static List<KnowledgeSection> parseSections(String content) {
        List<KnowledgeSection> parsed = new ArrayList<>();
        String[] chunks = ("\n" + content).split("\n" + SECTION_MARKER);
        // chunks[0] is the preamble before the first heading
        for (int i = 1; i < chunks.length; i++) {
            String chunk = chunks[i].strip();
            if (chunk.isEmpty()) {
                continue;
            }
            int newline = chunk.indexOf('\n');
            String title = newline < 0 ? chunk : chunk.substring(0, newline).strip();
            String body = newline < 0 ? "" : chunk.substring(newline + 1).strip();
            parsed.add(new KnowledgeSection(title, body));
        }
        return List.copyOf(parsed);
    }
}
