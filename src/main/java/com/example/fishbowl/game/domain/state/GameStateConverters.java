package com.example.fishbowl.game.domain.state;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * 상태 enum을 소문자 값("round_intro" 등)으로 저장하기 위한 JPA 컨버터 모음
 */
public final class GameStateConverters {

    private GameStateConverters() {
    }

    @Converter(autoApply = true)
    public static class GameStatusConverter implements AttributeConverter<GameStatus, String> {
        @Override
        public String convertToDatabaseColumn(GameStatus attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public GameStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : GameStatus.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class GameSubStatusConverter implements AttributeConverter<GameSubStatus, String> {
        @Override
        public String convertToDatabaseColumn(GameSubStatus attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public GameSubStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : GameSubStatus.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class PhraseStatusConverter implements AttributeConverter<PhraseStatus, String> {
        @Override
        public String convertToDatabaseColumn(PhraseStatus attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public PhraseStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : PhraseStatus.fromValue(dbData);
        }
    }

    @Converter(autoApply = true)
    public static class PausedReasonConverter implements AttributeConverter<PausedReason, String> {
        @Override
        public String convertToDatabaseColumn(PausedReason attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public PausedReason convertToEntityAttribute(String dbData) {
            return dbData == null ? null : PausedReason.fromValue(dbData);
        }
    }
}
