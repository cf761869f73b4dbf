package com.demoAuto.salesAgent.knowledge.service;

import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.knowledge.model.KnowledgeSection;
import com.demoAuto.salesAgent.llm.service.EmbeddingUnavailableException;
import com.demoAuto.salesAgent.retrieval.RetrievalUnavailableException;
import com.demoAuto.salesAgent.retrieval.ScoredItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseServiceTest {

    private SalesAgentProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SalesAgentProperties();
        properties.getKnowledge().setResource("knowledge/test-info.md");
    }

    @Test
    void sectionsAreSplitOnSecondLevelHeadings() {
        List<KnowledgeSection> sections = KnowledgeBaseService.parseSections("""
                # Title
                intro
                ## Location
                Main street 1
                Open daily

                ## Empty
                ## Hours
                9 to 6
                """);

        assertEquals(3, sections.size());
        assertEquals(new KnowledgeSection("Location", "Main street 1\nOpen daily"), sections.get(0));
        assertEquals(new KnowledgeSection("Empty", ""), sections.get(1));
        assertEquals("Empty", sections.get(1).text());
        assertEquals("Hours\n9 to 6", sections.get(2).text());
    }

    @Test
    void documentWithoutHeadingsHasNoSections() {
        assertTrue(KnowledgeBaseService.parseSections("just text\n# only a title").isEmpty());
    }

    @Test
    void loadedSectionsAreRetrievable() {
        KnowledgeBaseService service = new KnowledgeBaseService(properties,
                text -> text.startsWith("Warranty") || text.contains("guarantee") ? new float[]{1f, 0f} : new float[]{0f, 1f});
        service.load();

        List<ScoredItem<KnowledgeSection>> results = service.topK("what guarantee do I get?", 1);

        assertEquals(2, service.getSections().size());
        assertEquals("Warranty", results.get(0).item().getTitle());
        assertEquals("3 months or 3,000 km.", results.get(0).item().getBody());
    }

    @Test
    void embeddingFailureLeavesSectionsButNoIndex() {
        KnowledgeBaseService service = new KnowledgeBaseService(properties, text -> {
            throw new EmbeddingUnavailableException("no key");
        });
        service.load();

        assertEquals(2, service.getSections().size());
        assertThrows(RetrievalUnavailableException.class, () -> service.topK("warranty", 3));
    }

    @Test
    void missingResourceLoadsNothing() {
        properties.getKnowledge().setResource("knowledge/does-not-exist.md");
        KnowledgeBaseService service = new KnowledgeBaseService(properties, text -> new float[]{1f});
        service.load();

        assertTrue(service.getSections().isEmpty());
        assertThrows(RetrievalUnavailableException.class, () -> service.topK("warranty", 3));
    }
}
