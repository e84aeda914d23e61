/**
 * Literature search: CNKI client, response parsing, token retrieval and the concurrent client pool.
 */
package fr.lapetina.thesis.client.search;
