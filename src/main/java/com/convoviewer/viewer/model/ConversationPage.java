package com.convoviewer.viewer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationPage {

    private SessionRef session;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Integer total;

    private Integer page;

    private Integer perPage;

    private Integer totalPages;

    private String search;

    private Role role;
}
