package com.pongnet.gameserver.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Court geometry and simulation tuning. All values are in court units (pixels on the
 * reference client) and ticks.
 */
@Validated
@ConfigurationProperties(prefix = "pong.game")
public record GameProperties(
        @DefaultValue("640") @Positive int courtWidth,
        @DefaultValue("480") @Positive int courtHeight,
        @DefaultValue("10") @Positive int paddleWidth,
        @DefaultValue("50") @Positive int paddleHeight,
        @DefaultValue("10") @Min(0) int paddleInset,
        @DefaultValue("5") @Positive int paddleSpeed,
        @DefaultValue("5") @Positive int ballSize,
        @DefaultValue("5") @Positive int ballSpeed,
        @DefaultValue("6") @Positive int maxBallSpeedY,
        @DefaultValue("5") @Positive int winScore,
        @DefaultValue("60") @Positive @Max(1000) int tickRate
) {
    public GameProperties {
        if (paddleHeight >= courtHeight) {
            throw new IllegalArgumentException("paddleHeight must be smaller than courtHeight");
        }
        if (ballSize >= courtHeight || ballSize >= courtWidth) {
            throw new IllegalArgumentException("ballSize must fit inside the court");
        }
        if (2 * (paddleInset + paddleWidth) >= courtWidth) {
            throw new IllegalArgumentException("paddles overlap; widen the court or shrink the inset");
        }
        // a faster ball could cross a paddle face between two ticks
        if (ballSpeed > paddleWidth + ballSize) {
            throw new IllegalArgumentException("ballSpeed must not exceed paddleWidth + ballSize");
        }
    }

    public static GameProperties defaults() {
        return new GameProperties(640, 480, 10, 50, 10, 5, 5, 5, 6, 5, 60);
    }

    public int initialPaddleY() {
        return courtHeight / 2 - paddleHeight / 2;
    }

    public int maxPaddleY() {
        return courtHeight - paddleHeight;
    }

    public int leftPaddleX() {
        return paddleInset;
    }

    public int rightPaddleX() {
        return courtWidth - paddleInset - paddleWidth;
    }

    public int centreBallX() {
        return courtWidth / 2 - ballSize / 2;
    }

    public int centreBallY() {
        return courtHeight / 2 - ballSize / 2;
    }

    public int maxBallX() {
        return courtWidth - ballSize;
    }

    public int maxBallY() {
        return courtHeight - ballSize;
    }

    public Duration tickInterval() {
        return Duration.ofNanos(1_000_000_000L / tickRate);
    }
}
