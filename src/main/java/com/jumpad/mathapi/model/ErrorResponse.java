package com.jumpad.mathapi.model;

/**
 * Body of every error response.
 *
 * <pre>
 * {
 *     "erro": "VALUE_ERROR",
 *     "detalhes": "Erro de valor na operação de soma: ..."
 * }
 * </pre>
 *
 * @param erro     the error kind, stable for clients to branch on
 * @param detalhes human readable description
 */
public record ErrorResponse(String erro, String detalhes) {
}
