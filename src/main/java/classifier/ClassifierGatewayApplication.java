package classifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClassifierGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClassifierGatewayApplication.class, args);
  }
}
