package com.musicbox.domain.port;

import com.musicbox.domain.model.NfcTag;
import com.musicbox.domain.model.TagIdentifier;

import java.util.List;
import java.util.Optional;

/**
 * Puerto (interfaz) para la persistencia de tags NFC.
 * Es la fuente de verdad de "a qué playlist cree estar asociado un tag".
 */
public interface TagRepository {

    /**
     * Busca un tag por su identificador.
     *
     * @param identifier Identificador normalizado
     * @return Optional con el tag si existe
     */
    Optional<NfcTag> findByIdentifier(TagIdentifier identifier);

    /**
     * Guarda (crea o reemplaza) un tag.
     *
     * @param tag Tag a guardar
     */
    void save(NfcTag tag);

    /**
     * Obtiene todos los tags conocidos.
     */
    List<NfcTag> findAll();

    /**
     * Cuenta los tags conocidos.
     */
    long count();
}
