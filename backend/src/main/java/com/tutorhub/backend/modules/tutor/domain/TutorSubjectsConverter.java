package com.tutorhub.backend.modules.tutor.domain;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * 과목을 enum 선언 순서대로 쉼표 구분 문자열로 저장한다.
 */
@Converter
public class TutorSubjectsConverter implements AttributeConverter<Set<TutorSubject>, String> {

    @Override
    public String convertToDatabaseColumn(Set<TutorSubject> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "";
        }
        return EnumSet.copyOf(attribute).stream().map(Enum::name).collect(Collectors.joining(","));
    }

    @Override
    public Set<TutorSubject> convertToEntityAttribute(String dbData) {
        EnumSet<TutorSubject> subjects = EnumSet.noneOf(TutorSubject.class);
        if (dbData == null || dbData.isBlank()) {
            return subjects;
        }
        Arrays.stream(dbData.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(TutorSubject::valueOf)
                .forEach(subjects::add);
        return subjects;
    }
}
