package predict.market.trading;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PredictionMarketApplication {

    public static void main(String[] args) {
        SpringApplication.run(PredictionMarketApplication.class, args);
    }
}
