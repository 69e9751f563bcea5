package com.excelgrid.app;

import com.excelgrid.app.models.GridProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Boots the grid host: REST endpoints over in-memory formula grids.
 */
@SpringBootApplication
@EnableConfigurationProperties(GridProperties.class)
public class ExcelGridApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExcelGridApplication.class, args);
    }
}
