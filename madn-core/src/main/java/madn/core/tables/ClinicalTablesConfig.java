package madn.core.tables;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClinicalTablesConfig {
    @Bean
    public ClinicalTables clinicalTables(
            ObjectMapper objectMapper,
            @Value("${madn.tables.location:classpath:tables/}") String location
    ) {
        return ClinicalTables.load(objectMapper, location);
    }
}
