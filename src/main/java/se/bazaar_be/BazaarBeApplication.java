package se.bazaar_be;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BazaarBeApplication {

    public static void main(String[] args) {
        SpringApplication.run(BazaarBeApplication.class, args);
    }

}
