package io.github.hide212131.langchain4j.atelier.runtime.provider;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

final class DryRunChatModel implements ChatModel {

    @Override
    public ChatResponse doChat(ChatRequest request) {
        return DryRunResponder.respond(request);
    }
}
