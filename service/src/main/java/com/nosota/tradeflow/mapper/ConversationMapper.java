package com.nosota.tradeflow.mapper;

import com.nosota.tradeflow.api.request.AttachmentPayload;
import com.nosota.tradeflow.api.response.AttachmentResponse;
import com.nosota.tradeflow.api.response.ConversationResponse;
import com.nosota.tradeflow.api.response.MessageResponse;
import com.nosota.tradeflow.api.response.ParticipantResponse;
import com.nosota.tradeflow.model.Conversation;
import com.nosota.tradeflow.model.ConversationParticipant;
import com.nosota.tradeflow.model.Message;
import com.nosota.tradeflow.model.MessageAttachment;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for conversations and messages.
 */
@Mapper
public interface ConversationMapper {

    ConversationMapper INSTANCE = Mappers.getMapper(ConversationMapper.class);

    ConversationResponse toResponse(Conversation conversation);

    List<ConversationResponse> toResponseList(List<Conversation> conversations);

    ParticipantResponse toParticipantResponse(ConversationParticipant participant);

    /**
     * Maps a message together with the participants whose read marker covers it.
     *
     * @param message Message entity
     * @param readBy  IDs of the users that have read the message
     * @return MessageResponse
     */
    @Mapping(target = "conversationId", source = "message.conversation.id")
    @Mapping(target = "readBy", source = "readBy")
    MessageResponse toMessageResponse(Message message, List<Long> readBy);

    AttachmentResponse toAttachmentResponse(MessageAttachment attachment);

    MessageAttachment toAttachment(AttachmentPayload payload);

    List<MessageAttachment> toAttachments(List<AttachmentPayload> payloads);
}
