package com.litscan;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * @author litscan
 * @since 2025-03-02
 */
@SpringBootApplication
@EnableAsync
@MapperScan("com.litscan.mapper")
public class LitScanApplication {

	public static void main(String[] args) {
		SpringApplication.run(LitScanApplication.class, args);
		System.out.println("===========================================================\n"+
		 "接口文档 UI (Swagger): " + "http://localhost:8080/swagger-ui.html\n"
		 + "===========================================================");

	}

}
