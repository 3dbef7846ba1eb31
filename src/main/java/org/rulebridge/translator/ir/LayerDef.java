package org.rulebridge.translator.ir;

/**
 * A drawn layer declared in the deck, selected by its GDS layer and datatype numbers.
 *
 * @param name The layer name, unique within a deck.
 * @param gdsLayer The GDS layer number.
 * @param gdsDatatype The GDS datatype number, 0 when the declaration omits it.
 */
public record LayerDef(String name, int gdsLayer, int gdsDatatype) {

    /**
     * Creates a layer definition with the default datatype 0.
     * @param name The layer name.
     * @param gdsLayer The GDS layer number.
     */
    public LayerDef(String name, int gdsLayer) {
        this(name, gdsLayer, 0);
    }
}
