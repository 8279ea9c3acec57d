package perf.foresight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PerfForesightApplication {

  public static void main(String[] args) {
    SpringApplication.run(PerfForesightApplication.class, args);
  }
}
