package uy.gub.bps.towerdefense;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TowerDefenseApplication {

    public static void main(String[] args) {
        SpringApplication.run(TowerDefenseApplication.class, args);
    }
}
