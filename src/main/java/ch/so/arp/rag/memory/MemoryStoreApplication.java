package ch.so.arp.rag.memory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemoryStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryStoreApplication.class, args);
    }
}
