package com.autosort.oracle;

import com.autosort.models.NamingConvention;
import com.autosort.models.OracleKind;
import com.autosort.models.PromptContext;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptShaperTest {

    private PromptContext context(String projectType) {
        Map<String, List<String>> taxonomy = new LinkedHashMap<>();
        taxonomy.put("Documents", List.of("Reports"));
        taxonomy.put("Photos", List.of());
        return PromptContext.builder()
            .rootName("Home")
            .fileName("q1.pdf")
            .extension(".pdf")
            .category("docs")
            .projectType(projectType)
            .fileHint("Type=Doc; Name=q1.pdf; Parent=Home; Ancestors=Home")
            .taxonomySample(taxonomy)
            .siblingFiles(List.of("q2.pdf"))
            .namingConvention(NamingConvention.PASCAL_CASE)
            .build();
    }

    @Test
    void baseRequestCarriesContext() {
        String request = PromptShaper.baseRequest(context("general"));
        assertTrue(request.contains("Root: Home"));
        assertTrue(request.contains("- Documents: Reports"));
        assertTrue(request.contains("- Photos"));
        assertTrue(request.contains("File: q1.pdf"));
        assertTrue(request.contains("Sibling files: q2.pdf"));
        assertTrue(request.contains("Folder naming style: PascalCase"));
        assertFalse(request.contains("Project guidelines"));
    }

    @Test
    void codeProjectsGetGuidelines() {
        assertTrue(PromptShaper.baseRequest(context("python")).contains("Separate tests in 'tests/' or 'test/'"));
        assertTrue(PromptShaper.baseRequest(context("terraform")).contains("Keep modules in 'modules/'"));
    }

    @Test
    void refineRequestCarriesCandidate() {
        String request = PromptShaper.refineRequest(context("general"), "Home/Documents");
        assertTrue(request.contains("Candidate: Home/Documents"));
        assertTrue(request.contains("otherwise return it unchanged"));
    }

    @Test
    void shapesPerProvider() {
        String local = PromptShaper.shape(OracleKind.LOCAL, "REQ", "python");
        String openai = PromptShaper.shape(OracleKind.OPENAI, "REQ", "unknown");
        String grok = PromptShaper.shape(OracleKind.GROK, "REQ", null);

        assertTrue(local.startsWith("REQ"));
        assertTrue(local.endsWith("Project type: python"));
        assertTrue(openai.startsWith("As a file organization expert"));
        assertTrue(openai.endsWith("Folder path:"));
        assertTrue(grok.contains("Nothing else."));
        assertFalse(grok.contains("Project context"));
    }

    @Test
    void shapingIsDeterministic() {
        String request = PromptShaper.baseRequest(context("nodejs"));
        assertEquals(PromptShaper.shape(OracleKind.GROK, request, "nodejs"),
            PromptShaper.shape(OracleKind.GROK, request, "nodejs"));
    }

    @Test
    void onlyHostedKindsHaveSystemMessages() {
        assertNull(PromptShaper.systemMessage(OracleKind.LOCAL));
        assertNotNull(PromptShaper.systemMessage(OracleKind.OPENAI));
        assertNotNull(PromptShaper.systemMessage(OracleKind.GROK));
    }
}
