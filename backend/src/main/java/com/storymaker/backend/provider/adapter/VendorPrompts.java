package com.storymaker.backend.provider.adapter;

import com.storymaker.backend.provider.GenerationRequest;

/**
 * Prompt wording sent to the text vendors.
 */
final class VendorPrompts {

    static final String ENHANCER_SYSTEM_PROMPT =
            "You are an expert story enhancer and writing coach. Enhance story prompts to be more detailed and compelling.";

    private VendorPrompts() {
    }

    static String detailedStoryPrompt(GenerationRequest request) {
        return "You are a creative and engaging storyteller. Write a " + request.length().getValue()
                + " story (approximately " + request.length().getTargetWords() + " words) in the "
                + request.genre().getValue() + " genre.\n\n"
                + "Story prompt: \"" + request.prompt() + "\"\n\n"
                + "Requirements:\n"
                + "- Create an engaging, well-structured narrative\n"
                + "- Include vivid descriptions and compelling characters\n"
                + "- Develop a clear beginning, middle, and end\n"
                + "- Make it age-appropriate and family-friendly\n"
                + "- Ensure the story flows naturally and is immersive\n"
                + "- Use rich, descriptive language\n"
                + "- Include dialogue where appropriate\n\n"
                + "Please write the complete story now:";
    }

    static String compactStoryPrompt(GenerationRequest request) {
        return "Write a " + request.length().getValue() + " story (" + request.length().getTargetWords()
                + " words) in the " + request.genre().getValue() + " genre based on this prompt: \""
                + request.prompt() + "\". Create an engaging narrative with vivid descriptions and compelling characters. "
                + "Make it family-friendly and well-structured.";
    }

    static String enhancementBrief(GenerationRequest request) {
        String genre = request.genre().getValue();
        return "Enhance this " + genre + " story prompt for a " + request.length().getValue() + " story ("
                + request.length().getTargetWords() + " words):\n\n"
                + "Original prompt: \"" + request.prompt() + "\"\n\n"
                + "Please enhance it by adding:\n"
                + "1. Narrative structure guidance (beginning, middle, end)\n"
                + "2. Character development suggestions\n"
                + "3. Dialogue and interaction prompts\n"
                + "4. Atmospheric and environmental descriptions\n"
                + "5. Plot development elements\n"
                + "6. Themes and meaningful messages\n"
                + "7. Age-appropriate content guidelines\n\n"
                + "Make the enhanced prompt detailed enough to guide the creation of a compelling " + genre + " story.";
    }

    /** Output token budget for a story: 1.5 tokens per target word, capped. */
    static int storyTokenBudget(GenerationRequest request, int cap) {
        return (int) Math.min(request.length().getTargetWords() * 1.5, cap);
    }
}
