package com.dbbaskette.codeguardian;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest
@TestPropertySource(properties = {
        "spring.ai.anthropic.api-key=test-key",
        "codeguardian.github.token=test-token",
        "spring.datasource.url=jdbc:h2:mem:codeguardian;DB_CLOSE_DELAY=-1"
})
class CodeGuardianApplicationTests {

    @Test
    void contextLoads() {
    }
}
