package com.convoviewer.viewer.controller;

import com.convoviewer.viewer.exception.SessionNotFoundException;
import com.convoviewer.viewer.exception.SourceUnavailableException;
import com.convoviewer.viewer.model.ConversationPage;
import com.convoviewer.viewer.model.GlobalSearchResult;
import com.convoviewer.viewer.model.Message;
import com.convoviewer.viewer.model.Project;
import com.convoviewer.viewer.model.Role;
import com.convoviewer.viewer.model.SessionRef;
import com.convoviewer.viewer.model.Source;
import com.convoviewer.viewer.search.SearchAggregator;
import com.convoviewer.viewer.service.ConversationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversationController.class)
class ConversationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationService conversationService;

    @MockBean
    private SearchAggregator searchAggregator;

    @Test
    void testListProjects() throws Exception {
        when(conversationService.listProjects(Source.QWEN)).thenReturn(List.of(Project.builder()
                .source(Source.QWEN)
                .projectId("3f9a1c2b")
                .displayName("Billing Service")
                .sessionCount(4)
                .lastModified(Instant.parse("2024-05-01T10:00:00Z"))
                .build()));

        mockMvc.perform(get("/api/projects").param("source", "qwen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].source").value("qwen"))
                .andExpect(jsonPath("$[0].projectId").value("3f9a1c2b"))
                .andExpect(jsonPath("$[0].sessionCount").value(4));
    }

    @Test
    void testDefaultSourceIsClaude() throws Exception {
        when(conversationService.listProjects(Source.CLAUDE)).thenReturn(List.of());

        mockMvc.perform(get("/api/projects"))
                .andExpect(status().isOk());

        verify(conversationService).listProjects(Source.CLAUDE);
    }

    @Test
    void testUnknownSourceIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/projects").param("source", "bogus"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(conversationService);
    }

    @Test
    void testUnavailableSourceIs503() throws Exception {
        when(conversationService.listProjects(Source.CLAUDE))
                .thenThrow(new SourceUnavailableException(Source.CLAUDE, "/nope", "root directory does not exist"));

        mockMvc.perform(get("/api/projects"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.source").value("claude"))
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void testMissingSessionIs404() throws Exception {
        when(conversationService.getConversation(eq(Source.CLAUDE), eq("p"), eq("missing"), anyInt(), anyInt(), any(), any()))
                .thenThrow(new SessionNotFoundException(Source.CLAUDE, "p", "missing"));

        mockMvc.perform(get("/api/conversation/p/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void testGetConversationPassesFilters() throws Exception {
        when(conversationService.getConversation(Source.CLAUDE, "p", "s", 2, 10, "error", Role.ASSISTANT))
                .thenReturn(ConversationPage.builder()
                        .session(SessionRef.of(Source.CLAUDE, "p", "s"))
                        .messages(List.of(Message.builder()
                                .lineIndex(12)
                                .role(Role.ASSISTANT)
                                .content("No error here")
                                .rawType("assistant")
                                .build()))
                        .total(11)
                        .page(2)
                        .perPage(10)
                        .totalPages(2)
                        .search("error")
                        .role(Role.ASSISTANT)
                        .build());

        mockMvc.perform(get("/api/conversation/p/s")
                        .param("page", "2")
                        .param("perPage", "10")
                        .param("search", "error")
                        .param("role", "assistant"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages[0].lineIndex").value(12))
                .andExpect(jsonPath("$.messages[0].role").value("assistant"))
                .andExpect(jsonPath("$.totalPages").value(2));
    }

    @Test
    void testUnknownRoleIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/conversation/p/s").param("role", "robot"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testDottedSessionIdIsKeptWhole() throws Exception {
        mockMvc.perform(get("/api/conversation/ws1/aiService.prompts/summary").param("source", "cursor"))
                .andExpect(status().isOk());

        verify(conversationService).getSessionSummary(Source.CURSOR, "ws1", "aiService.prompts");
    }

    @Test
    void testSessionSearchRequiresQuery() throws Exception {
        mockMvc.perform(get("/api/conversation/p/s/search"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testSessionSearch() throws Exception {
        mockMvc.perform(get("/api/conversation/p/s/search").param("q", "NullPointer").param("offset", "20"))
                .andExpect(status().isOk());

        verify(conversationService).searchSession(Source.CLAUDE, "p", "s", "NullPointer", 20, 20);
    }

    @Test
    void testGlobalSearchParsesSources() throws Exception {
        when(searchAggregator.searchGlobal(anyString(), anyInt(), any())).thenReturn(GlobalSearchResult.builder()
                .query("docker")
                .limit(5)
                .totalCandidates(0)
                .build());

        mockMvc.perform(get("/api/search/global").param("q", "docker").param("limit", "5").param("sources", "claude,qwen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("docker"))
                .andExpect(jsonPath("$.hits").isArray());

        verify(searchAggregator).searchGlobal("docker", 5, List.of(Source.CLAUDE, Source.QWEN));
    }

    @Test
    void testGlobalSearchBlankQueryIsBadRequest() throws Exception {
        when(searchAggregator.searchGlobal(eq(" "), anyInt(), any()))
                .thenThrow(new IllegalArgumentException("Search query must not be blank"));

        mockMvc.perform(get("/api/search/global").param("q", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Search query must not be blank"));
    }

    @Test
    void testProjectSessions() throws Exception {
        mockMvc.perform(get("/api/projects/-Users-me-api/sessions").param("source", "kiro"))
                .andExpect(status().isOk());

        verify(conversationService).listSessions(Source.KIRO, "-Users-me-api");
    }

    @Test
    void testSearchFilterIsOptional() throws Exception {
        mockMvc.perform(get("/api/conversation/p/s"))
                .andExpect(status().isOk());

        verify(conversationService).getConversation(eq(Source.CLAUDE), eq("p"), eq("s"), eq(1), eq(50), isNull(), isNull());
    }
}
