package com.shopsync.ordersync;

import com.google.api.services.sheets.v4.Sheets;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

@SpringBootTest(properties = {
        "aws.region=us-east-1",
        "google.sheets.spreadsheet-id=test-sheet"
})
class OrderSyncApplicationTests {

    @MockBean
    private Sheets sheets;

    @MockBean
    private BedrockRuntimeClient bedrockRuntimeClient;

    @Test
    void contextLoads() {
        // Sheets and Bedrock clients are mocked; everything else is wired for real.
    }
}
