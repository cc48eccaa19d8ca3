package com.edge.registration;

import com.edge.registration.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgeRegistrationApplication {

    public static void main(String[] args) {
        // OpenCV 必须在 Spring 创建任何 Bean 之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(EdgeRegistrationApplication.class, args);
    }
}
