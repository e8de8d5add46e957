package com.aec.AdminDrive;

import com.aec.AdminDrive.drive.DriveProviderClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

@SpringBootTest
class AdminDriveApplicationTests {

    @MockBean
    DriveProviderClient provider;

    @Test
    void contextLoads() {
    }
}
