package com.example.shorturl.repository;

import com.example.shorturl.config.ShortenerProperties;
import com.example.shorturl.exception.ErrorKind;
import com.example.shorturl.exception.ServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionTimedOutException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaShortUrlStoreTimeoutTest {

    @Mock
    private ShortUrlRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TransactionStatus transactionStatus;

    private JpaShortUrlStore store;

    @BeforeEach
    void setUp() {
        ShortenerProperties properties = new ShortenerProperties();
        properties.setRequestTimeout(Duration.ofSeconds(7));
        when(transactionManager.getTransaction(any())).thenReturn(transactionStatus);
        store = new JpaShortUrlStore(repository, transactionManager, properties);
    }

    @Test
    @DisplayName("transactions are opened with the configured request timeout")
    void transactionUsesRequestTimeout() {
        when(repository.existsByShortCode("abc123")).thenReturn(true);

        assertTrue(store.existsByCode("abc123"));

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertEquals(7, definition.getValue().getTimeout());
    }

    @Test
    void queryTimeoutBecomesInternalError() {
        when(repository.existsByShortCode("abc123")).thenThrow(new QueryTimeoutException("statement cancelled"));

        ServiceException ex = assertThrows(ServiceException.class, () -> store.existsByCode("abc123"));

        assertEquals(ErrorKind.INTERNAL, ex.getKind());
        assertEquals("persistence call timed out", ex.getDetail());
        assertInstanceOf(QueryTimeoutException.class, ex.getCause());
        verify(transactionManager).rollback(transactionStatus);
    }

    @Test
    void transactionTimeoutBecomesInternalError() {
        when(repository.count()).thenThrow(new TransactionTimedOutException("deadline reached"));

        ServiceException ex = assertThrows(ServiceException.class, () -> store.count());

        assertEquals(ErrorKind.INTERNAL, ex.getKind());
        assertEquals("persistence call timed out", ex.getDetail());
    }

    @Test
    void otherFailuresKeepOperationMessage() {
        when(repository.count()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        ServiceException ex = assertThrows(ServiceException.class, () -> store.count());

        assertEquals(ErrorKind.INTERNAL, ex.getKind());
        assertEquals("failed to count records", ex.getDetail());
    }
}
