package com.shopcraft.api.service.generation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 프롬프트에 들어가는 대화 한 턴 (역할 + 내용, 마지막 user 턴만 이미지 참조를 가질 수 있음)
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ChatTurn {

    private final TurnRole role;
    private final String content;
    private final String imageRef;

    private ChatTurn(TurnRole role, String content, String imageRef) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
        this.imageRef = imageRef;
    }

    public static ChatTurn of(TurnRole role, String content) {
        return new ChatTurn(role, content, null);
    }

    public static ChatTurn system(String content) {
        return of(TurnRole.SYSTEM, content);
    }

    public static ChatTurn user(String content) {
        return of(TurnRole.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return of(TurnRole.ASSISTANT, content);
    }

    public ChatTurn withImage(String imageRef) {
        return new ChatTurn(role, content, imageRef);
    }

    public boolean hasImage() {
        return imageRef != null && !imageRef.isBlank();
    }
}
