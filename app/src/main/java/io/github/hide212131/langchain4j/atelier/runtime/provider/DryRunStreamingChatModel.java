package io.github.hide212131.langchain4j.atelier.runtime.provider;

import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;

final class DryRunStreamingChatModel implements StreamingChatModel {

    @Override
    public void doChat(ChatRequest request, StreamingChatResponseHandler handler) {
        ChatResponse response = DryRunResponder.respond(request);
        for (String chunk : DryRunResponder.chunks(response.aiMessage().text())) {
            handler.onPartialResponse(chunk);
        }
        handler.onCompleteResponse(response);
    }
}
