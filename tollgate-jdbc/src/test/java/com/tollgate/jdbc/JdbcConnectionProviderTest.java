package com.tollgate.jdbc;

import com.tollgate.config.TollgateConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TimeZone;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcConnectionProviderTest {

    private static final TimeZone BANGKOK = TimeZone.getTimeZone("Asia/Bangkok");

    private TimeZone saved;

    @BeforeEach
    void setUp() {
        saved = TimeZone.getDefault();
        TimeZone.setDefault(BANGKOK);
    }

    @AfterEach
    void tearDown() {
        TimeZone.setDefault(saved);
    }

    @Test
    void connectionProperties_carryCredentialsAndUtcSession() {
        TollgateConfig config = TollgateConfig.builder().dbUser("billing").dbPassword("s3cret").build();

        Properties props = new JdbcConnectionProvider(config).connectionProperties();

        assertEquals("billing", props.getProperty("user"));
        assertEquals("s3cret", props.getProperty("password"));
        assertEquals("-c TimeZone=UTC", props.getProperty("options"));
    }

    @Test
    void getConnection_concurrentCallsLeaveDefaultZoneAlone() throws Exception {
        TollgateConfig config = TollgateConfig.builder().dbHost("127.0.0.1").dbPort(1).build();
        JdbcConnectionProvider provider = new JdbcConnectionProvider(config);
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 10; i++) {
                        assertThrows(SQLException.class, provider::getConnection);
                        assertEquals(BANGKOK.getID(), TimeZone.getDefault().getID());
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(BANGKOK.getID(), TimeZone.getDefault().getID());
    }
}
