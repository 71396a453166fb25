package com.shopcraft.common.prompt;

import java.util.List;

/**
 * 전자상거래 소재 생성 프롬프트 상수
 */
public final class AssetPrompts {

    private AssetPrompts() {}

    /**
     * 텍스트 모델 시스템 지시문 (출력 계약: 필드명, 언어, 길이 제한)
     */
    public static final String ASSET_SYSTEM =
            "你是电商运营专家。基于用户上传的商品信息与描述，仅返回一个JSON对象：" +
            "{\"title\":string,\"selling_points\":string[],\"atmosphere\":string," +
            "\"video_script\":Array<{s:number,v:string}>}，" +
            "中文输出，标题10-30字，卖点3-5条，脚本3-10秒。";

    /**
     * 대표 이미지 합성 지시문 머리말
     */
    public static final String HERO_INSTRUCTION_PREFIX =
            "基于参考商品图生成电商主图，保持商品主体外观一致，背景干净有质感，突出卖点与氛围。";

    // ===== 모의(mock) 소재 =====

    public static final String MOCK_TITLE = "优选好物";

    public static final int MOCK_TITLE_MAX_LENGTH = 24;

    public static final List<String> MOCK_SELLING_POINTS = List.of(
            "品质保障",
            "便捷实用",
            "性价比高",
            "口碑推荐"
    );

    public static final String MOCK_ATMOSPHERE = "焕新季";

    public static final List<String> MOCK_SCRIPT_CAPTIONS = List.of(
            "开场特写",
            "使用场景展示",
            "卖点字幕与下单引导"
    );

    public static final List<Integer> MOCK_SCRIPT_SECONDS = List.of(0, 2, 6);
}
