package sample.threedsecure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThreeDSServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreeDSServerApplication.class, args);
    }
}
