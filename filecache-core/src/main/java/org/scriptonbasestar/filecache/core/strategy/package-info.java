/**
 * 파일 캐시 전략
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.filecache.core.strategy.EvictionStrategy} - 축출 대상 선택</li>
 *   <li>{@link org.scriptonbasestar.filecache.core.strategy.KeyStrategy} - 키 생성 방식 (RANDOM, STRUCTURED)</li>
 *   <li>{@link org.scriptonbasestar.filecache.core.strategy.CapacityMode} - 용량 단위 (항목 수, 바이트)</li>
 * </ul>
 *
 * @author archmagece
 * @since 2026-10
 */
package org.scriptonbasestar.filecache.core.strategy;
