package com.williamcallahan.lawlens;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.retrieval.base-url=http://localhost:8000",
        "app.viewer.max-sessions=100"
})
class LawLensApplicationTests {

    @Test
    void contextLoads() {
    }

}
