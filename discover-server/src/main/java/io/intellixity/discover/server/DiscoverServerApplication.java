package io.intellixity.discover.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class DiscoverServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(DiscoverServerApplication.class, args);
  }
}
