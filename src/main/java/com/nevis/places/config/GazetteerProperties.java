package com.nevis.places.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.gazetteer")
public record GazetteerProperties(
	@NotNull Resource source,
	@DefaultValue("4") @Min(0) @Max(1000) int maxResults
) {}
