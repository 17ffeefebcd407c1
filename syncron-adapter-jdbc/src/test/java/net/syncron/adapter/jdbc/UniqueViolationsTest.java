package net.syncron.adapter.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

import static org.junit.jupiter.api.Assertions.*;

class UniqueViolationsTest {

    @Test
    void standard_sqlstate() {
        assertTrue(UniqueViolations.isUniqueViolation(new SQLException("dup", "23505", 23505)));
    }

    @Test
    void vendor_codes_within_integrity_class() {
        assertTrue(UniqueViolations.isUniqueViolation(
                new SQLIntegrityConstraintViolationException("ORA-00001: unique constraint violated", "23000", 1)));
        assertTrue(UniqueViolations.isUniqueViolation(new SQLException("Duplicate entry", "23000", 1062)));
        assertTrue(UniqueViolations.isUniqueViolation(new SQLException("Cannot insert duplicate key", "23000", 2627)));
        assertTrue(UniqueViolations.isUniqueViolation(new SQLException("Cannot insert duplicate key row", "23000", 2601)));
    }

    @Test
    void other_errors_are_not_duplicates() {
        assertFalse(UniqueViolations.isUniqueViolation(new SQLException("not null", "23502", 1400)));
        assertFalse(UniqueViolations.isUniqueViolation(new SQLException("connection", "08006", 17002)));
        assertFalse(UniqueViolations.isUniqueViolation(new SQLException("vendor 1 outside class", "42000", 1)));
        assertFalse(UniqueViolations.isUniqueViolation(new SQLException("no state")));
    }

    @Test
    void chained_and_wrapped_exceptions_are_inspected() {
        SQLException batch = new SQLException("batch failed", "HY000", 0);
        batch.setNextException(new SQLException("dup", "23505", 0));
        assertTrue(UniqueViolations.isUniqueViolation(batch));

        SQLException wrapper = new SQLException("wrapped", "HY000", 0, new SQLException("dup", "23505", 0));
        assertTrue(UniqueViolations.isUniqueViolation(wrapper));
    }
}
