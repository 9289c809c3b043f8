package com.wellbridge.ai.agent.state;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ChatTurn(Role role, String content) {

    public enum Role {
        USER,
        ASSISTANT
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(Role.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(Role.ASSISTANT, content);
    }

    @JsonIgnore
    public boolean isUser() {
        return role == Role.USER;
    }
}
