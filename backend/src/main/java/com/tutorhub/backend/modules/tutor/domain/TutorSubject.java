package com.tutorhub.backend.modules.tutor.domain;

public enum TutorSubject {
    MATHEMATICS,
    PHYSICS,
    CHEMISTRY,
    BIOLOGY,
    ENGLISH,
    COMPUTER_SCIENCE,
    PROGRAMMING,
    OTHER
}
