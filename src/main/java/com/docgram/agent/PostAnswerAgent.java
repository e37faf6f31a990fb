package com.docgram.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent answering questions about a single PDF post.
 *
 * <p>The retrieved context arrives pre-formatted as {@code Source:} blocks. Prior turns of the
 * conversation are passed as plain text so follow-up questions resolve correctly.
 */
public interface PostAnswerAgent {

  @SystemMessage(
      """
        You are an AI Q&A assistant for a PDF document shared on Docgram.
        Use only the provided context to answer the user's question.
        Cite the 'Source' lines when relevant.
        If the context does not contain the answer, say so briefly instead of guessing.
        Answer concisely.
        """)
  @UserMessage(
      """
        Document: {{title}}

        Conversation so far:
        {{history}}

        Context:
        {{context}}

        User question:
        {{question}}
        """)
  String answer(
      @V("title") String title,
      @V("history") String history,
      @V("context") String context,
      @V("question") String question);
}
