package com.example.MedifBot.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "chat_messages", indexes = {
        @Index(name = "chat_messages_conv_idx", columnList = "conversationId, createdAt")
})
@Getter
@Setter
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String conversationId;

    @Column(nullable = false)
    private String role;

    @Lob
    @Column(columnDefinition = "TEXT", nullable = false)
    private String content;

    private String ip;

    private String status;

    private String notes;

    private Instant createdAt;

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = "pending";
        }
        if (notes == null) {
            notes = "";
        }
    }

    public ConversationTurn toTurn() {
        return new ConversationTurn(role, content, createdAt);
    }
}
