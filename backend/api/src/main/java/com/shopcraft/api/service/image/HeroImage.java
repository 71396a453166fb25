package com.shopcraft.api.service.image;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class HeroImage {
    private final String url;
    private final HeroImageSource source;
}
