package com.rfidattendance.domain.port;

import java.util.Map;

/**
 * Puerto para la tabla clave/valor de ajustes del operador.
 */
public interface SettingsStore {

    /**
     * @return Todos los ajustes guardados
     */
    Map<String, String> loadAll();

    /**
     * Guarda (inserta o reemplaza) un ajuste.
     */
    void save(String key, String value);
}
