package org.muralis.maps.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@ActiveProfiles("test")
class RestClientConfigTest {

    @Autowired
    @Qualifier("googleMapsRestClient")
    private RestClient restClient;

    @Test
    void testRestClientBeanIsCreated() {
        assertNotNull(restClient,
                "RestClient bean should be created successfully");
    }
}
