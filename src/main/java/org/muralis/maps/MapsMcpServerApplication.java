package org.muralis.maps;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MapsMcpServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MapsMcpServerApplication.class, args);
    }
}
