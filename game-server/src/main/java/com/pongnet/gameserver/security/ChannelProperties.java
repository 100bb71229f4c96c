package com.pongnet.gameserver.security;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pong.channel")
public record ChannelProperties(
        @DefaultValue("data/channel.key") @NotBlank String keyFile
) {
}
