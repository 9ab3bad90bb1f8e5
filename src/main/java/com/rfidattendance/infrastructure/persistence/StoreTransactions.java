package com.rfidattendance.infrastructure.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Ejecuta una unidad de trabajo en una transacción y traduce cualquier fallo,
 * incluido el del commit, a excepciones del dominio.
 */
@Component
@Slf4j
public class StoreTransactions {

    private final TransactionTemplate transactionTemplate;
    private final StoreExceptionTranslator translator;

    public StoreTransactions(PlatformTransactionManager transactionManager,
                             StoreExceptionTranslator translator) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.translator = translator;
    }

    /**
     * @param operation Nombre de la operación para logs y mensajes
     * @param work      Trabajo a ejecutar dentro de la transacción
     * @return Resultado del trabajo
     */
    public <T> T execute(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (RuntimeException e) {
            throw translator.translate(operation, e);
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }
}
