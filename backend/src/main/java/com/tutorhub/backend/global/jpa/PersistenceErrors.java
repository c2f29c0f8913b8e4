package com.tutorhub.backend.global.jpa;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

public final class PersistenceErrors {

    private PersistenceErrors() {
    }

    /**
     * True when {@code ex} or one of its causes is a database constraint violation, whether or
     * not Spring has translated it yet.
     */
    public static boolean isConstraintViolation(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof ConstraintViolationException
                    || current instanceof DataIntegrityViolationException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
