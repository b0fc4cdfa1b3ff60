package io.shopfloor.mes.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProductionSchedulingApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProductionSchedulingApplication.class, args);
  }
}
