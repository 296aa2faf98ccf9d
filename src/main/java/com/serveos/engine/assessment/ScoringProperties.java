package com.serveos.engine.assessment;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param multiSelectStrategy aggregation applied to answers that select several options
 */
@ConfigurationProperties(prefix = "engine.scoring")
public record ScoringProperties(@DefaultValue("average") SelectionScoreStrategy multiSelectStrategy) {}
