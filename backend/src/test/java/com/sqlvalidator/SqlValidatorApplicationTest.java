package com.sqlvalidator;

import com.sqlvalidator.model.CheckerDescriptor;
import com.sqlvalidator.rule.CheckerRegistry;
import com.sqlvalidator.service.SqlValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SqlValidatorApplicationTest {

    @Autowired
    private CheckerRegistry registry;

    @Autowired
    private SqlValidator validator;

    @Test
    void shouldRegisterBuiltInCheckersInOrder() {
        List<String> expected = CheckerFixtures.builtInCheckers().stream().map(c -> c.name()).toList();
        List<String> actual = registry.describe().stream().map(CheckerDescriptor::getName).toList();

        assertEquals(expected, actual);
        assertFalse(validator.isParallelFamilies());
        assertTrue(validator.validate("SELECT id FROM users LIMIT 10;").isValid());
    }
}
