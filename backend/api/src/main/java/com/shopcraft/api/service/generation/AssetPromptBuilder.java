package com.shopcraft.api.service.generation;

import com.shopcraft.api.dto.AssetDto;
import com.shopcraft.common.prompt.AssetPrompts;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 텍스트 모델 입력 턴 목록 / 대표 이미지 지시문 조립
 * 순수 변환 (부수효과 없음)
 */
@Component
public class AssetPromptBuilder {

    /**
     * 시스템 지시문 + 이전 대화 + 현재 설명 (+ 이미지)
     * 이미지 참조는 마지막 턴에만 붙음
     */
    public List<ChatTurn> buildFull(GenerationRequest request) {
        List<ChatTurn> turns = new ArrayList<>();
        turns.add(ChatTurn.system(AssetPrompts.ASSET_SYSTEM));
        for (ChatTurn turn : request.getHistory()) {
            // 이력에는 역할/내용만 (이미지 참조 제거)
            turns.add(ChatTurn.of(turn.getRole(), turn.getContent()));
        }
        turns.add(currentTurn(request));
        return turns;
    }

    /**
     * 시스템 지시문 + 현재 설명 (+ 이미지), 이력 제외
     */
    public List<ChatTurn> buildMinimal(GenerationRequest request) {
        return List.of(ChatTurn.system(AssetPrompts.ASSET_SYSTEM), currentTurn(request));
    }

    /**
     * 소재 → 대표 이미지 합성 지시문
     */
    public String buildHeroInstruction(AssetDto.Asset asset) {
        StringBuilder sb = new StringBuilder(AssetPrompts.HERO_INSTRUCTION_PREFIX);
        if (asset == null) {
            return sb.toString();
        }
        if (hasText(asset.getTitle())) {
            sb.append("标题：").append(asset.getTitle()).append("。");
        }
        if (asset.getSellingPoints() != null && !asset.getSellingPoints().isEmpty()) {
            sb.append("卖点：").append(String.join("、", asset.getSellingPoints())).append("。");
        }
        if (hasText(asset.getAtmosphere())) {
            sb.append("氛围：").append(asset.getAtmosphere()).append("。");
        }
        return sb.toString();
    }

    private ChatTurn currentTurn(GenerationRequest request) {
        ChatTurn current = ChatTurn.user(request.getDescription());
        return request.getImageRef() != null ? current.withImage(request.getImageRef()) : current;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
