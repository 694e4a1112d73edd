package com.fleet.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatabaseConfigValidatorTest {

    @Test
    void acceptsCompleteDatasource() {
        DatabaseConfigValidator validator = validator("jdbc:postgresql://db:5432/fleetdb?connectTimeout=3", "fleetuser", "fleetpass");

        assertThatCode(() -> validator.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }

    @Test
    void namesEveryMissingSetting() {
        DatabaseConfigValidator validator = validator("jdbc:postgresql://db:5432/fleetdb", " ", "");

        assertThat(validator.missingSettings())
                .containsExactly("spring.datasource.username", "spring.datasource.password");
        assertThatThrownBy(() -> validator.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spring.datasource.username, spring.datasource.password");
    }

    @Test
    void stripsConnectionOptionsFromLoggedUrl() {
        assertThat(DatabaseConfigValidator.withoutQuery("jdbc:postgresql://db:5432/fleetdb?connectTimeout=3"))
                .isEqualTo("jdbc:postgresql://db:5432/fleetdb");
        assertThat(DatabaseConfigValidator.withoutQuery("jdbc:h2:mem:fleetdb")).isEqualTo("jdbc:h2:mem:fleetdb");
    }

    private DatabaseConfigValidator validator(String url, String user, String password) {
        DatabaseConfigValidator validator = new DatabaseConfigValidator();
        ReflectionTestUtils.setField(validator, "dbUrl", url);
        ReflectionTestUtils.setField(validator, "dbUser", user);
        ReflectionTestUtils.setField(validator, "dbPassword", password);
        return validator;
    }
}
